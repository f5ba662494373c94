package com.dingdangmaoup.bootsync.simplestreams;

import java.util.List;

/**
 * Matching of images against {@link BootSourceSelection} filters
 */
public final class ImageFilters {

    public static final String ANY = "*";

    private ImageFilters() {
    }

    public static boolean valuePassesFilter(String filterValue, String value) {
        return ANY.equals(filterValue) || (filterValue != null && filterValue.equals(value));
    }

    /**
     * An empty list lets nothing through.
     */
    public static boolean valuePassesFilterList(List<String> filterList, String value) {
        if (filterList == null) {
            return false;
        }
        return filterList.stream().anyMatch(filterValue -> valuePassesFilter(filterValue, value));
    }

    /**
     * An image passes when there are no filters or when any one filter matches it.
     */
    public static boolean imagePassesFilter(List<BootSourceSelection> filters, String os, String arch,
                                            String subarch, String release, String label) {
        if (filters == null || filters.isEmpty()) {
            return true;
        }
        return filters.stream().anyMatch(filter ->
                valuePassesFilter(filter.getOs(), os)
                        && valuePassesFilter(filter.getRelease(), release)
                        && valuePassesFilterList(filter.getArches(), arch)
                        && valuePassesFilterList(filter.getSubarches(), subarch)
                        && valuePassesFilterList(filter.getLabels(), label));
    }

    public static boolean imagePassesFilter(List<BootSourceSelection> filters, ImageSpec spec) {
        return imagePassesFilter(filters, spec.getOs(), spec.getArch(), spec.getSubarch(),
                spec.getRelease(), spec.getLabel());
    }
}
