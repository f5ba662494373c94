package com.dingdangmaoup.bootsync.simplestreams;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Acceptance rules for simplestreams product names.
 * <p>
 * Products for operating systems without a dedicated rule are accepted.
 */
public final class ProductValidator {

    private static final Pattern BOOTLOADER_PRODUCT = Pattern.compile("^[^:]+:1:[^:]+:[^:]+:[^:]+$");
    private static final Pattern UBUNTU_CORE_PRODUCT = Pattern.compile("^[^:]+:v4:[^:]+:[^:]+:[^:]+:[^:]+$");
    private static final Pattern UBUNTU_PRODUCT =
            Pattern.compile("^[^:]+:v([23]|3\\+platform):boot:[^:]+:[^:]+:[^:]+$", Pattern.CASE_INSENSITIVE);

    /**
     * (os, bootloader-type, arch) combinations a region can serve
     */
    static final List<List<String>> SUPPORTED_BOOTLOADERS = List.of(
            List.of("pxelinux", "pxe", "i386"),
            List.of("grub-efi-signed", "uefi", "amd64"),
            List.of("grub-efi", "uefi", "arm64"),
            List.of("grub-ieee1275", "open-firmware", "ppc64el"));

    private ProductValidator() {
    }

    public static boolean validateProduct(Map<String, ?> data, String productName) {
        if (data.containsKey("bootloader-type")) {
            if (!BOOTLOADER_PRODUCT.matcher(productName).matches()) {
                return false;
            }
            List<String> bootloader = List.of(
                    Objects.toString(data.get("os"), ""),
                    Objects.toString(data.get("bootloader-type"), ""),
                    Objects.toString(data.get("arch"), ""));
            return SUPPORTED_BOOTLOADERS.contains(bootloader);
        }
        Object os = data.get("os");
        if ("ubuntu-core".equals(os)) {
            return UBUNTU_CORE_PRODUCT.matcher(productName).matches();
        }
        if ("ubuntu".equals(os)) {
            return UBUNTU_PRODUCT.matcher(productName).matches();
        }
        return true;
    }
}
