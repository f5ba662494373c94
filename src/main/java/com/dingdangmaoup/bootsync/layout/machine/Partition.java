package com.dingdangmaoup.bootsync.layout.machine;

import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

@Getter
@ToString(of = {"name", "size", "bootable"})
public class Partition implements StorageDevice {

    private final PartitionTable partitionTable;
    private final String name;
    private final long size;
    private final boolean bootable;
    @Setter
    private Filesystem filesystem;

    Partition(PartitionTable partitionTable, String name, long size, boolean bootable) {
        this.partitionTable = partitionTable;
        this.name = name;
        this.size = size;
        this.bootable = bootable;
    }
}
