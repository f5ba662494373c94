package com.dingdangmaoup.bootsync.layout;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;
import java.util.Optional;

/**
 * Filesystem types a machine's storage can carry. Only the formattable and special
 * types can be named in a layout; the others mark members of RAID arrays, volume
 * groups and bcache devices.
 */
@Getter
@RequiredArgsConstructor
public enum FilesystemType {

    EXT2("ext2", Kind.FORMAT),
    EXT4("ext4", Kind.FORMAT),
    XFS("xfs", Kind.FORMAT),
    FAT32("fat32", Kind.FORMAT),
    VFAT("vfat", Kind.FORMAT),
    SWAP("swap", Kind.FORMAT),
    BTRFS("btrfs", Kind.FORMAT),
    ZFSROOT("zfsroot", Kind.FORMAT),
    TMPFS("tmpfs", Kind.SPECIAL),
    RAMFS("ramfs", Kind.SPECIAL),
    RAID("raid", Kind.MEMBER),
    RAID_SPARE("raid-spare", Kind.MEMBER),
    LVM_PV("lvm-pv", Kind.MEMBER),
    BCACHE_CACHE("bcache-cache", Kind.MEMBER),
    BCACHE_BACKING("bcache-backing", Kind.MEMBER);

    @JsonValue
    private final String value;
    private final Kind kind;

    public boolean isSpecial() {
        return kind == Kind.SPECIAL;
    }

    /**
     * Look up a type that may appear in a layout document
     */
    public static Optional<FilesystemType> fromLayoutValue(String value) {
        return Arrays.stream(values())
                .filter(t -> t.kind != Kind.MEMBER)
                .filter(t -> t.value.equals(value))
                .findFirst();
    }

    private enum Kind {
        FORMAT, SPECIAL, MEMBER
    }
}
