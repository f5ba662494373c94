package com.dingdangmaoup.bootsync.layout;

import com.dingdangmaoup.bootsync.layout.StorageEntry.Bcache;
import com.dingdangmaoup.bootsync.layout.StorageEntry.Disk;
import com.dingdangmaoup.bootsync.layout.StorageEntry.FileSystem;
import com.dingdangmaoup.bootsync.layout.StorageEntry.LogicalVolume;
import com.dingdangmaoup.bootsync.layout.StorageEntry.Lvm;
import com.dingdangmaoup.bootsync.layout.StorageEntry.Partition;
import com.dingdangmaoup.bootsync.layout.StorageEntry.Raid;
import com.dingdangmaoup.bootsync.layout.StorageEntry.SpecialDevice;
import com.dingdangmaoup.bootsync.layout.machine.BlockDevice;
import com.dingdangmaoup.bootsync.layout.machine.CacheSet;
import com.dingdangmaoup.bootsync.layout.machine.Filesystem;
import com.dingdangmaoup.bootsync.layout.machine.FilesystemGroup;
import com.dingdangmaoup.bootsync.layout.machine.FilesystemGroupType;
import com.dingdangmaoup.bootsync.layout.machine.Machine;
import com.dingdangmaoup.bootsync.layout.machine.PartitionTable;
import com.dingdangmaoup.bootsync.layout.machine.PhysicalBlockDevice;
import com.dingdangmaoup.bootsync.layout.machine.StorageDevice;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Applies a parsed {@link StorageLayout} to the disks of a machine.
 * <p>
 * The machine's previous storage configuration is removed first. Entries are then
 * applied in dependency order, each one resolving the devices it builds on by name.
 * Not meant to run concurrently for the same machine.
 */
@Slf4j
@Component
public class StorageLayoutApplier {

    /**
     * Partitions and logical volumes are rounded down to this boundary
     */
    public static final long ALIGNMENT_SIZE = 4L * 1024 * 1024;

    static final CacheMode DEFAULT_CACHE_MODE = CacheMode.WRITETHROUGH;

    /**
     * @throws UnappliableLayoutException if the machine lacks a disk the layout needs or
     *                                    the devices are too small for it
     */
    public void apply(StorageLayout layout, Machine machine) {
        Set<String> missing = new TreeSet<>(layout.diskNames());
        machine.getPhysicalBlockDevices().forEach(device -> missing.remove(device.getName()));
        if (!missing.isEmpty()) {
            throw new UnappliableLayoutException("Unknown machine disk(s): " + String.join(", ", missing));
        }

        machine.clearStorageConfiguration();
        Context context = new Context(machine);
        for (StorageEntry entry : layout.getSortedEntries()) {
            applyEntry(context, entry);
        }
        log.info("Applied custom storage layout to machine {}: {} devices, {} filesystem groups",
                machine.getSystemId(), layout.getEntries().size(), machine.getFilesystemGroups().size());
    }

    private void applyEntry(Context context, StorageEntry entry) {
        if (entry instanceof Disk disk) {
            applyDisk(context, disk);
        } else if (entry instanceof Partition partition) {
            applyPartition(context, partition);
        } else if (entry instanceof FileSystem fs) {
            applyFilesystem(context, fs);
        } else if (entry instanceof Raid raid) {
            applyRaid(context, raid);
        } else if (entry instanceof Lvm lvm) {
            applyLvm(context, lvm);
        } else if (entry instanceof LogicalVolume volume) {
            applyLogicalVolume(context, volume);
        } else if (entry instanceof Bcache bcache) {
            applyBcache(context, bcache);
        } else if (!(entry instanceof SpecialDevice)) {
            // StorageEntry is sealed; a new variant must be handled above
            throw new IllegalStateException("Unhandled storage entry " + entry);
        }
    }

    private void applyDisk(Context context, Disk disk) {
        PhysicalBlockDevice device = context.machine.findPhysicalBlockDevice(disk.getName())
                .orElseThrow(() -> new UnappliableLayoutException("Unknown machine disk(s): " + disk.getName()));
        if (disk.getPtable() != null) {
            device.createPartitionTable(disk.getPtable());
        }
        if (disk.isBoot()) {
            context.machine.setBootDisk(device);
        }
        context.devices.put(disk.getName(), device);
    }

    private void applyPartition(Context context, Partition partition) {
        StorageDevice parent = context.device(partition.getOn());
        PartitionTable table = parent instanceof BlockDevice block ? block.getPartitionTable() : null;
        if (table == null) {
            throw new UnappliableLayoutException("Device '" + partition.getOn() + "' has no partition table");
        }
        long size = alignDown(partition.getSize());
        if (size > table.getAvailableSize()) {
            throw new UnappliableLayoutException("Not enough space on '" + partition.getOn()
                    + "' for partition '" + partition.getName() + "'");
        }
        context.devices.put(partition.getName(), table.addPartition(partition.getName(), size, partition.isBootable()));
    }

    private void applyFilesystem(Context context, FileSystem fs) {
        String mountOptions = fs.getMountOptions() == null ? "" : fs.getMountOptions();
        Filesystem filesystem = Filesystem.builder()
                .fstype(fs.getType())
                .mountPoint(fs.getMount())
                .mountOptions(mountOptions)
                .build();
        if (fs.getType().isSpecial()) {
            context.machine.addSpecialFilesystem(filesystem);
            return;
        }
        StorageDevice device = context.device(fs.getOn());
        context.requireUnused(device);
        device.setFilesystem(filesystem);
    }

    private void applyRaid(Context context, Raid raid) {
        FilesystemGroupType type = FilesystemGroupType.raid(raid.getLevel());
        if (raid.getMembers().size() < type.getMinimumDevices()) {
            throw new UnappliableLayoutException("RAID level " + raid.getLevel() + " needs at least "
                    + type.getMinimumDevices() + " devices, '" + raid.getName() + "' has "
                    + raid.getMembers().size());
        }
        FilesystemGroup group = context.machine.addFilesystemGroup(new FilesystemGroup(raid.getName(), type));
        long smallest = Long.MAX_VALUE;
        for (String name : raid.getMembers()) {
            StorageDevice member = context.addMember(group, name, FilesystemType.RAID);
            smallest = Math.min(smallest, member.getSize());
        }
        for (String name : raid.getSpares()) {
            context.addMember(group, name, FilesystemType.RAID_SPARE);
        }
        long size = type.raidSize(raid.getMembers().size(), smallest);
        context.devices.put(raid.getName(), context.machine.addVirtualBlockDevice(raid.getName(), size, group));
    }

    private void applyLvm(Context context, Lvm lvm) {
        FilesystemGroup group = context.machine.addFilesystemGroup(
                new FilesystemGroup(lvm.getName(), FilesystemGroupType.LVM_VG));
        for (String name : lvm.getMembers()) {
            context.addMember(group, name, FilesystemType.LVM_PV);
        }
        context.volumeGroups.put(lvm.getName(), group);
    }

    private void applyLogicalVolume(Context context, LogicalVolume volume) {
        FilesystemGroup group = context.volumeGroups.get(volume.getOn());
        if (group == null) {
            throw new UnappliableLayoutException("Unknown volume group '" + volume.getOn() + "'");
        }
        long size = alignDown(volume.getSize());
        if (size > group.getFreeSize()) {
            throw new UnappliableLayoutException("Not enough space in volume group '" + volume.getOn()
                    + "' for logical volume '" + volume.getName() + "'");
        }
        context.devices.put(volume.getName(), context.machine.addVirtualBlockDevice(volume.getName(), size, group));
    }

    private void applyBcache(Context context, Bcache bcache) {
        String cacheSetKey = bcache.getCacheDevice() + "[cacheset]";
        CacheSet cacheSet = context.cacheSets.get(cacheSetKey);
        if (cacheSet == null) {
            StorageDevice cacheDevice = context.device(bcache.getCacheDevice());
            context.requireUnused(cacheDevice);
            cacheSet = context.machine.addCacheSet(new CacheSet(cacheDevice));
            cacheDevice.setFilesystem(Filesystem.builder()
                    .fstype(FilesystemType.BCACHE_CACHE)
                    .cacheSet(cacheSet)
                    .build());
            context.cacheSets.put(cacheSetKey, cacheSet);
        }

        CacheMode cacheMode = bcache.getCacheMode() == null ? DEFAULT_CACHE_MODE : bcache.getCacheMode();
        FilesystemGroup group = context.machine.addFilesystemGroup(
                new FilesystemGroup(bcache.getName(), FilesystemGroupType.BCACHE, cacheMode, cacheSet));
        StorageDevice backing = context.addMember(group, bcache.getBackingDevice(), FilesystemType.BCACHE_BACKING);
        context.devices.put(bcache.getName(),
                context.machine.addVirtualBlockDevice(bcache.getName(), backing.getSize(), group));
    }

    static long alignDown(long size) {
        return size - size % ALIGNMENT_SIZE;
    }

    /**
     * Devices created so far, by layout name
     */
    private static class Context {

        private final Machine machine;
        private final Map<String, StorageDevice> devices = new HashMap<>();
        private final Map<String, FilesystemGroup> volumeGroups = new HashMap<>();
        private final Map<String, CacheSet> cacheSets = new HashMap<>();

        Context(Machine machine) {
            this.machine = machine;
        }

        StorageDevice device(String name) {
            StorageDevice device = devices.get(name);
            if (device == null) {
                throw new UnappliableLayoutException("Unknown device '" + name + "'");
            }
            return device;
        }

        StorageDevice addMember(FilesystemGroup group, String name, FilesystemType fstype) {
            StorageDevice device = device(name);
            requireUnused(device);
            machine.addMember(group, device, Filesystem.member(fstype, group));
            return device;
        }

        void requireUnused(StorageDevice device) {
            if (device.getFilesystem() != null) {
                throw new UnappliableLayoutException("Device '" + device.getName() + "' is already in use");
            }
            if (device instanceof BlockDevice block && block.getPartitionTable() != null
                    && !block.getPartitionTable().getPartitions().isEmpty()) {
                throw new UnappliableLayoutException("Device '" + device.getName() + "' is partitioned");
            }
        }
    }
}
