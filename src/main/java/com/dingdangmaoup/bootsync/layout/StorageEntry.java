package com.dingdangmaoup.bootsync.layout;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * One element of a flattened storage layout. Entries refer to each other by name and
 * {@link #deps()} lists the names that must be applied before this one.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = StorageEntry.Disk.class, name = "disk"),
        @JsonSubTypes.Type(value = StorageEntry.Partition.class, name = "partition"),
        @JsonSubTypes.Type(value = StorageEntry.FileSystem.class, name = "filesystem"),
        @JsonSubTypes.Type(value = StorageEntry.Raid.class, name = "raid"),
        @JsonSubTypes.Type(value = StorageEntry.Lvm.class, name = "lvm"),
        @JsonSubTypes.Type(value = StorageEntry.LogicalVolume.class, name = "logical-volume"),
        @JsonSubTypes.Type(value = StorageEntry.Bcache.class, name = "bcache"),
        @JsonSubTypes.Type(value = StorageEntry.SpecialDevice.class, name = "special")
})
public sealed interface StorageEntry permits StorageEntry.Disk, StorageEntry.Partition, StorageEntry.FileSystem,
        StorageEntry.Raid, StorageEntry.Lvm, StorageEntry.LogicalVolume, StorageEntry.Bcache,
        StorageEntry.SpecialDevice {

    String getName();

    Set<String> deps();

    /**
     * Name of the filesystem entry attached to a device
     */
    static String filesystemName(String device) {
        return device + "[fs]";
    }

    @Value
    @AllArgsConstructor
    class Disk implements StorageEntry {
        String name;
        PartitionTableType ptable;
        boolean boot;

        /**
         * Bare disk referenced by another entry but not declared in the layout
         */
        public Disk(String name) {
            this(name, null, false);
        }

        @Override
        public Set<String> deps() {
            return Set.of();
        }
    }

    @Value
    @Builder
    class Partition implements StorageEntry {
        String name;
        String on;
        long size;
        boolean bootable;
        /** previous partition on the same disk */
        String after;

        @Override
        public Set<String> deps() {
            Set<String> deps = new LinkedHashSet<>();
            deps.add(on);
            if (after != null) {
                deps.add(after);
            }
            return deps;
        }
    }

    @Value
    @Builder(toBuilder = true)
    class FileSystem implements StorageEntry {
        String name;
        String on;
        FilesystemType type;
        @With
        String mount;
        @With
        String mountOptions;

        @Override
        public Set<String> deps() {
            return Set.of(on);
        }
    }

    @Value
    class Raid implements StorageEntry {
        String name;
        int level;
        List<String> members;
        List<String> spares;

        public Raid(String name, int level, List<String> members, List<String> spares) {
            this.name = name;
            this.level = level;
            this.members = List.copyOf(members);
            this.spares = List.copyOf(spares);
        }

        @Override
        public Set<String> deps() {
            Set<String> deps = new LinkedHashSet<>(members);
            deps.addAll(spares);
            return deps;
        }
    }

    @Value
    class Lvm implements StorageEntry {
        String name;
        List<String> members;

        public Lvm(String name, List<String> members) {
            this.name = name;
            this.members = List.copyOf(members);
        }

        @Override
        public Set<String> deps() {
            return new LinkedHashSet<>(members);
        }
    }

    @Value
    class LogicalVolume implements StorageEntry {
        String name;
        String on;
        long size;

        @Override
        public Set<String> deps() {
            return Set.of(on);
        }
    }

    @Value
    class Bcache implements StorageEntry {
        String name;
        String backingDevice;
        String cacheDevice;
        CacheMode cacheMode;

        @Override
        public Set<String> deps() {
            Set<String> deps = new LinkedHashSet<>();
            deps.add(backingDevice);
            deps.add(cacheDevice);
            return deps;
        }
    }

    /**
     * Placeholder device for tmpfs and ramfs mounts
     */
    @Value
    class SpecialDevice implements StorageEntry {
        String name;

        @Override
        public Set<String> deps() {
            return Set.of();
        }
    }
}
