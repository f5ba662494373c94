package com.dingdangmaoup.bootsync.layout.machine;

import com.dingdangmaoup.bootsync.layout.CacheMode;
import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * RAID array, LVM volume group or bcache device built out of member devices
 */
@Getter
@ToString(of = {"name", "groupType"})
public class FilesystemGroup {

    private final String name;
    private final FilesystemGroupType groupType;
    private final CacheMode cacheMode;
    private final CacheSet cacheSet;
    private final List<StorageDevice> members = new ArrayList<>();
    private final List<VirtualBlockDevice> virtualDevices = new ArrayList<>();

    public FilesystemGroup(String name, FilesystemGroupType groupType) {
        this(name, groupType, null, null);
    }

    public FilesystemGroup(String name, FilesystemGroupType groupType, CacheMode cacheMode, CacheSet cacheSet) {
        this.name = name;
        this.groupType = groupType;
        this.cacheMode = cacheMode;
        this.cacheSet = cacheSet;
    }

    public List<StorageDevice> getMembers() {
        return Collections.unmodifiableList(members);
    }

    public List<VirtualBlockDevice> getVirtualDevices() {
        return Collections.unmodifiableList(virtualDevices);
    }

    void addMember(StorageDevice device) {
        members.add(device);
    }

    void addVirtualDevice(VirtualBlockDevice device) {
        virtualDevices.add(device);
    }

    /**
     * Space in a volume group not yet taken by logical volumes
     */
    public long getFreeSize() {
        long total = members.stream().mapToLong(StorageDevice::getSize).sum();
        return total - virtualDevices.stream().mapToLong(VirtualBlockDevice::getSize).sum();
    }
}
