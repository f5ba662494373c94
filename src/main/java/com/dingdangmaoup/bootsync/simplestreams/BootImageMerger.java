package com.dingdangmaoup.bootsync.simplestreams;

import java.util.List;

public final class BootImageMerger {

    private BootImageMerger() {
    }

    public static void bootMerge(BootImageMapping destination, BootImageMapping additions) {
        bootMerge(destination, additions, null);
    }

    /**
     * Copy into {@code destination} the entries of {@code additions} that pass {@code filters}.
     * Entries already in {@code destination} are never replaced, so earlier sources take precedence.
     */
    public static void bootMerge(BootImageMapping destination, BootImageMapping additions,
                                 List<BootSourceSelection> filters) {
        additions.items().forEach((spec, item) -> {
            if (!destination.contains(spec) && ImageFilters.imagePassesFilter(filters, spec)) {
                destination.set(spec, item);
            }
        });
    }
}
