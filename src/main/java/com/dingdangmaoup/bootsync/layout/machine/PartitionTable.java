package com.dingdangmaoup.bootsync.layout.machine;

import com.dingdangmaoup.bootsync.layout.PartitionTableType;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

@Getter
public class PartitionTable {

    private final BlockDevice blockDevice;
    private final PartitionTableType tableType;
    private final List<Partition> partitions = new ArrayList<>();

    PartitionTable(BlockDevice blockDevice, PartitionTableType tableType) {
        this.blockDevice = blockDevice;
        this.tableType = tableType;
    }

    public List<Partition> getPartitions() {
        return Collections.unmodifiableList(partitions);
    }

    public long getAvailableSize() {
        return blockDevice.getSize() - partitions.stream().mapToLong(Partition::getSize).sum();
    }

    /**
     * Append a partition after the existing ones
     *
     * @throws IllegalArgumentException if the device has no room left for it
     */
    public Partition addPartition(String name, long size, boolean bootable) {
        if (size > getAvailableSize()) {
            throw new IllegalArgumentException("Partition '" + name + "' of " + size
                    + " bytes doesn't fit on '" + blockDevice.getName() + "'");
        }
        Partition partition = new Partition(this, name, size, bootable);
        partitions.add(partition);
        return partition;
    }
}
