package com.dingdangmaoup.bootsync.simplestreams;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Walks a simplestreams mirror and folds every accepted item into a {@link BootImageMapping}.
 */
@Slf4j
public class RepoDumper {

    static final String PRODUCTS_FORMAT = "products:1.0";

    /**
     * Item keys carried over into the mapping
     */
    static final Set<String> KEPT_ITEM_KEYS = Set.of(
            "content_id", "product_name", "version_name", "path", "subarches",
            "release_codename", "release_title", "support_eol", "kflavor",
            "bootloader-type", "os_title", "gadget_title", "sha256", "size", "ftype");

    @Getter
    private final BootImageMapping mapping;
    private final boolean validateProducts;

    public RepoDumper(BootImageMapping mapping) {
        this(mapping, true);
    }

    public RepoDumper(BootImageMapping mapping, boolean validateProducts) {
        this.mapping = mapping;
        this.validateProducts = validateProducts;
    }

    /**
     * Read the index at {@code indexPath} and every products document it lists.
     * I/O failures are logged and propagated, nothing is retried here.
     */
    public Mono<BootImageMapping> sync(SimplestreamsReader reader, String indexPath) {
        return reader.read(indexPath)
                .flatMapMany(index -> Flux.fromIterable(productsPaths(index)))
                .concatMap(reader::read)
                .doOnNext(this::insertProducts)
                .then(Mono.fromSupplier(() -> mapping))
                .doOnError(RepoDumper::isIoError, e -> log.error("I/O error while syncing boot images.", e));
    }

    /**
     * Fold one item into the mapping.
     *
     * @param data        product data used for validation
     * @param item        item merged with its content, product and version data
     * @param productName name of the product the item belongs to
     */
    public void insertItem(Map<String, Object> data, Map<String, Object> item, String productName) {
        if (validateProducts && !ProductValidator.validateProduct(data, productName)) {
            log.debug("Ignoring unsupported product {}", productName);
            return;
        }
        String os = string(item, "os");
        String arch = string(item, "arch");
        String subarch = stringOrDefault(item, "subarch", "generic");
        String label = string(item, "label");

        String release;
        String kflavor;
        if (item.containsKey("bootloader-type")) {
            release = string(item, "bootloader-type");
            kflavor = "bootloader";
        } else {
            release = string(item, "release");
            kflavor = stringOrDefault(item, "kflavor", "generic");
        }

        Map<String, Object> compatItem = cleanUpRepoItem(item);
        if ("ubuntu-core".equals(os)) {
            ImageSpec spec = ImageSpec.of(os, arch, "generic", stringOrDefault(item, "kernel_snap", "generic"),
                    release + "-" + string(item, "gadget_snap"), label);
            mapping.setIfAbsent(spec, compatItem);
            return;
        }

        List<String> subarches = subarches(item);
        for (String compatSubarch : subarches) {
            mapping.setIfAbsent(ImageSpec.of(os, arch, compatSubarch, kflavor, release, label), compatItem);
        }
        mapping.set(ImageSpec.of(os, arch, subarch, kflavor, release, label), compatItem);

        if (isGenericAlias(os, item, release, subarch) && subarches.contains("generic")) {
            mapping.set(ImageSpec.of(os, arch, "generic", kflavor, release, label), compatItem);
        }
    }

    /**
     * Copy of the item restricted to the keys consumers of the mapping read.
     */
    public static Map<String, Object> cleanUpRepoItem(Map<String, Object> item) {
        Map<String, Object> cleaned = new LinkedHashMap<>();
        item.forEach((key, value) -> {
            if (KEPT_ITEM_KEYS.contains(key)) {
                cleaned.put(key, value);
            }
        });
        return cleaned;
    }

    /**
     * Scalar fields of every level from the products document down to the item,
     * deeper levels winning.
     */
    public static Map<String, Object> productsExdata(JsonNode tree, String productName, String versionName,
                                                     String itemName) {
        JsonNode product = tree.path("products").path(productName);
        JsonNode version = product.path("versions").path(versionName);
        JsonNode item = version.path("items").path(itemName);

        Map<String, Object> exdata = new LinkedHashMap<>();
        copyScalars(tree, exdata);
        copyScalars(product, exdata);
        copyScalars(version, exdata);
        copyScalars(item, exdata);
        exdata.put("product_name", productName);
        exdata.put("version_name", versionName);
        exdata.put("item_name", itemName);
        return exdata;
    }

    private void insertProducts(JsonNode tree) {
        Iterator<Map.Entry<String, JsonNode>> products = tree.path("products").fields();
        while (products.hasNext()) {
            Map.Entry<String, JsonNode> product = products.next();
            Iterator<Map.Entry<String, JsonNode>> versions = product.getValue().path("versions").fields();
            while (versions.hasNext()) {
                Map.Entry<String, JsonNode> version = versions.next();
                Iterator<String> items = version.getValue().path("items").fieldNames();
                while (items.hasNext()) {
                    Map<String, Object> exdata =
                            productsExdata(tree, product.getKey(), version.getKey(), items.next());
                    insertItem(exdata, exdata, product.getKey());
                }
            }
        }
    }

    private static List<String> productsPaths(JsonNode index) {
        List<String> paths = new ArrayList<>();
        index.path("index").forEach(entry -> {
            if (PRODUCTS_FORMAT.equals(entry.path("format").asText()) && entry.hasNonNull("path")) {
                paths.add(entry.get("path").asText());
            }
        });
        return paths;
    }

    private static void copyScalars(JsonNode node, Map<String, Object> target) {
        node.fields().forEachRemaining(field -> {
            JsonNode value = field.getValue();
            if (value.isTextual()) {
                target.put(field.getKey(), value.asText());
            } else if (value.isIntegralNumber()) {
                target.put(field.getKey(), value.asLong());
            } else if (value.isNumber()) {
                target.put(field.getKey(), value.asDouble());
            } else if (value.isBoolean()) {
                target.put(field.getKey(), value.asBoolean());
            }
        });
    }

    /**
     * An ubuntu item whose subarch is the GA kernel or the legacy HWE kernel named after
     * its own release also serves as the generic kernel.
     */
    private static boolean isGenericAlias(String os, Map<String, Object> item, String release, String subarch) {
        if (!"ubuntu".equals(os) || !item.containsKey("version") || release == null || release.isEmpty()) {
            return false;
        }
        String version = string(item, "version");
        return subarch.equals("ga-" + version) || subarch.equals("hwe-" + release.charAt(0));
    }

    private static List<String> subarches(Map<String, Object> item) {
        Object value = item.get("subarches");
        if (value == null || value.toString().isEmpty()) {
            return List.of("generic");
        }
        return List.of(value.toString().split(","));
    }

    private static String string(Map<String, Object> item, String key) {
        Object value = item.get(key);
        return value == null ? null : value.toString();
    }

    private static String stringOrDefault(Map<String, Object> item, String key, String defaultValue) {
        Object value = item.get(key);
        return value == null ? defaultValue : value.toString();
    }

    private static boolean isIoError(Throwable e) {
        return e instanceof IOException || e instanceof UncheckedIOException || e instanceof SimplestreamsException;
    }
}
