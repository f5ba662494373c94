package com.dingdangmaoup.bootsync.layout;

import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * A parsed storage layout: all entries by name in declaration order, plus the same
 * entries ordered so that every entry comes after its dependencies.
 */
@Getter
@ToString
public class StorageLayout {

    private final Map<String, StorageEntry> entries;
    private final List<StorageEntry> sortedEntries;

    public StorageLayout(Map<String, StorageEntry> entries, List<StorageEntry> sortedEntries) {
        this.entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
        this.sortedEntries = List.copyOf(sortedEntries);
    }

    /**
     * Names of the physical disks the layout needs
     */
    public Set<String> diskNames() {
        Set<String> names = new TreeSet<>();
        entries.values().forEach(entry -> {
            if (entry instanceof StorageEntry.Disk) {
                names.add(entry.getName());
            }
        });
        return names;
    }
}
