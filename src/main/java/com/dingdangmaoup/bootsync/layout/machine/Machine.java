package com.dingdangmaoup.bootsync.layout.machine;

import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Storage configuration of one machine. Physical disks come from hardware discovery;
 * everything else is built on top of them when a layout is applied.
 */
@Getter
public class Machine {

    private final String systemId;
    private final List<PhysicalBlockDevice> physicalBlockDevices = new ArrayList<>();
    private final List<VirtualBlockDevice> virtualBlockDevices = new ArrayList<>();
    private final List<FilesystemGroup> filesystemGroups = new ArrayList<>();
    private final List<CacheSet> cacheSets = new ArrayList<>();
    private final List<Filesystem> specialFilesystems = new ArrayList<>();
    @Setter
    private PhysicalBlockDevice bootDisk;

    public Machine(String systemId) {
        this.systemId = systemId;
    }

    public PhysicalBlockDevice addPhysicalBlockDevice(String name, long size) {
        PhysicalBlockDevice device = new PhysicalBlockDevice(name, size);
        physicalBlockDevices.add(device);
        return device;
    }

    public Optional<PhysicalBlockDevice> findPhysicalBlockDevice(String name) {
        return physicalBlockDevices.stream().filter(d -> d.getName().equals(name)).findFirst();
    }

    /**
     * Find a physical or virtual block device by name
     */
    public Optional<BlockDevice> findBlockDevice(String name) {
        return Stream.concat(physicalBlockDevices.stream(), virtualBlockDevices.stream())
                .filter(d -> d.getName().equals(name))
                .map(BlockDevice.class::cast)
                .findFirst();
    }

    public List<PhysicalBlockDevice> getPhysicalBlockDevices() {
        return Collections.unmodifiableList(physicalBlockDevices);
    }

    public List<VirtualBlockDevice> getVirtualBlockDevices() {
        return Collections.unmodifiableList(virtualBlockDevices);
    }

    public List<FilesystemGroup> getFilesystemGroups() {
        return Collections.unmodifiableList(filesystemGroups);
    }

    public List<CacheSet> getCacheSets() {
        return Collections.unmodifiableList(cacheSets);
    }

    public List<Filesystem> getSpecialFilesystems() {
        return Collections.unmodifiableList(specialFilesystems);
    }

    public FilesystemGroup addFilesystemGroup(FilesystemGroup group) {
        filesystemGroups.add(group);
        return group;
    }

    /**
     * Create a block device on top of a filesystem group
     */
    public VirtualBlockDevice addVirtualBlockDevice(String name, long size, FilesystemGroup group) {
        VirtualBlockDevice device = new VirtualBlockDevice(name, size, group);
        group.addVirtualDevice(device);
        virtualBlockDevices.add(device);
        return device;
    }

    /**
     * Format {@code device} as a member of {@code group}
     */
    public void addMember(FilesystemGroup group, StorageDevice device, Filesystem filesystem) {
        device.setFilesystem(filesystem);
        group.addMember(device);
    }

    public CacheSet addCacheSet(CacheSet cacheSet) {
        cacheSets.add(cacheSet);
        return cacheSet;
    }

    public void addSpecialFilesystem(Filesystem filesystem) {
        specialFilesystems.add(filesystem);
    }

    /**
     * Remove everything but the physical disks themselves
     */
    public void clearStorageConfiguration() {
        physicalBlockDevices.forEach(BlockDevice::clear);
        virtualBlockDevices.clear();
        filesystemGroups.clear();
        cacheSets.clear();
        specialFilesystems.clear();
    }
}
