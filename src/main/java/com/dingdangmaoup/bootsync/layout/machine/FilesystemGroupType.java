package com.dingdangmaoup.bootsync.layout.machine;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;

@Getter
@RequiredArgsConstructor
public enum FilesystemGroupType {

    RAID_0(0, 2),
    RAID_1(1, 2),
    RAID_5(5, 3),
    RAID_6(6, 4),
    RAID_10(10, 3),
    LVM_VG(-1, 1),
    BCACHE(-1, 1);

    private final int raidLevel;
    private final int minimumDevices;

    public boolean isRaid() {
        return raidLevel >= 0;
    }

    public static FilesystemGroupType raid(int level) {
        return Arrays.stream(values())
                .filter(t -> t.isRaid() && t.raidLevel == level)
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unsupported RAID level: " + level));
    }

    /**
     * Usable size of an array whose smallest member has {@code memberSize} bytes
     */
    public long raidSize(int members, long memberSize) {
        return switch (this) {
            case RAID_0 -> memberSize * members;
            case RAID_1 -> memberSize;
            case RAID_5 -> memberSize * (members - 1);
            case RAID_6 -> memberSize * (members - 2);
            case RAID_10 -> memberSize * members / 2;
            default -> throw new IllegalStateException(this + " is not a RAID type");
        };
    }
}
