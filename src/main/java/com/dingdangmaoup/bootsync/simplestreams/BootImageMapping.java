package com.dingdangmaoup.bootsync.simplestreams;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Mapping of {@link ImageSpec} to the product metadata describing it.
 * <p>
 * {@link #set} overwrites, {@link #setIfAbsent} keeps the first value written for a key.
 * Not thread safe: it is filled by a single dumper pass and only read afterwards.
 */
public class BootImageMapping {

    private static final TypeReference<Map<String, Map<String, Map<String, Map<String, Map<String, Map<String, Map<String, Object>>>>>>>> NESTED =
            new TypeReference<>() {};

    private final Map<ImageSpec, Map<String, Object>> mapping = new LinkedHashMap<>();

    public void set(ImageSpec spec, Map<String, Object> item) {
        mapping.put(spec, item);
    }

    /**
     * @return true when the item was stored, false when the key was already taken
     */
    public boolean setIfAbsent(ImageSpec spec, Map<String, Object> item) {
        return mapping.putIfAbsent(spec, item) == null;
    }

    public Optional<Map<String, Object>> get(ImageSpec spec) {
        return Optional.ofNullable(mapping.get(spec));
    }

    public boolean contains(ImageSpec spec) {
        return mapping.containsKey(spec);
    }

    public Map<ImageSpec, Map<String, Object>> items() {
        return Collections.unmodifiableMap(mapping);
    }

    public Set<ImageSpec> keys() {
        return Collections.unmodifiableSet(mapping.keySet());
    }

    public boolean isEmpty() {
        return mapping.isEmpty();
    }

    public int size() {
        return mapping.size();
    }

    /**
     * Architectures with at least one image in the mapping
     */
    public Set<String> getImageArches() {
        Set<String> arches = new TreeSet<>();
        mapping.keySet().forEach(spec -> arches.add(spec.getArch()));
        return arches;
    }

    /**
     * Serialise as nested objects: os, arch, subarch, kflavor, release, label.
     */
    public String dumpJson(ObjectMapper objectMapper) {
        Map<String, Map<String, Map<String, Map<String, Map<String, Map<String, Map<String, Object>>>>>>> tree = new TreeMap<>();
        mapping.forEach((spec, item) -> tree
                .computeIfAbsent(spec.getOs(), k -> new TreeMap<>())
                .computeIfAbsent(spec.getArch(), k -> new TreeMap<>())
                .computeIfAbsent(spec.getSubarch(), k -> new TreeMap<>())
                .computeIfAbsent(spec.getKflavor(), k -> new TreeMap<>())
                .computeIfAbsent(spec.getRelease(), k -> new TreeMap<>())
                .put(spec.getLabel(), item));
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(tree);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialise boot image mapping", e);
        }
    }

    /**
     * Inverse of {@link #dumpJson}
     */
    public static BootImageMapping loadJson(ObjectMapper objectMapper, String json) {
        BootImageMapping result = new BootImageMapping();
        try {
            objectMapper.readValue(json, NESTED).forEach((os, arches) ->
                    arches.forEach((arch, subarches) ->
                            subarches.forEach((subarch, kflavors) ->
                                    kflavors.forEach((kflavor, releases) ->
                                            releases.forEach((release, labels) ->
                                                    labels.forEach((label, item) -> result.set(
                                                            ImageSpec.of(os, arch, subarch, kflavor, release, label),
                                                            item)))))));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid boot image mapping document", e);
        }
        return result;
    }

    @Override
    public String toString() {
        return "BootImageMapping{" + mapping.size() + " images}";
    }
}
