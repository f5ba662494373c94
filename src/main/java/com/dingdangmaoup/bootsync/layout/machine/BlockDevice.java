package com.dingdangmaoup.bootsync.layout.machine;

import com.dingdangmaoup.bootsync.layout.PartitionTableType;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

@Getter
@ToString(of = {"name", "size"})
public abstract class BlockDevice implements StorageDevice {

    private final String name;
    private final long size;
    @Setter
    private Filesystem filesystem;
    private PartitionTable partitionTable;

    protected BlockDevice(String name, long size) {
        this.name = name;
        this.size = size;
    }

    public PartitionTable createPartitionTable(PartitionTableType tableType) {
        partitionTable = new PartitionTable(this, tableType);
        return partitionTable;
    }

    /**
     * Drop the partition table and filesystem of this device
     */
    void clear() {
        partitionTable = null;
        filesystem = null;
    }
}
