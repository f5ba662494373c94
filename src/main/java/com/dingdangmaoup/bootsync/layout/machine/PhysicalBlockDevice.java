package com.dingdangmaoup.bootsync.layout.machine;

public class PhysicalBlockDevice extends BlockDevice {

    public PhysicalBlockDevice(String name, long size) {
        super(name, size);
    }
}
