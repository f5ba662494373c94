package com.dingdangmaoup.bootsync.storage;

import java.util.Optional;
import java.util.function.Function;

/**
 * Derivation of the on-disk name of a file from its sha256.
 */
public final class FilenameOnDisk {

    public static final int DEFAULT_LENGTH = 7;

    private FilenameOnDisk() {
    }

    public static String shortSha(String sha256) {
        return shortSha(sha256, DEFAULT_LENGTH);
    }

    public static String shortSha(String sha256, int length) {
        return sha256.substring(0, Math.min(length, sha256.length())).toLowerCase();
    }

    /**
     * Pick the shortest prefix of {@code sha256}, at least {@code minLength} characters long,
     * that is not already used by a file with a different sha256. A file with the same sha256
     * keeps sharing its name.
     *
     * @param sha256 hash of the new file
     * @param minLength shortest prefix to consider
     * @param ownerOf sha256 of the file currently stored under a name, if any
     * @return the allocated filename
     */
    public static String allocate(String sha256, int minLength, Function<String, Optional<String>> ownerOf) {
        for (int length = minLength; length <= sha256.length(); length++) {
            String candidate = shortSha(sha256, length);
            Optional<String> owner = ownerOf.apply(candidate);
            if (owner.isEmpty() || owner.get().equalsIgnoreCase(sha256)) {
                return candidate;
            }
        }
        throw new IllegalStateException("No free filename on disk for " + sha256);
    }
}
