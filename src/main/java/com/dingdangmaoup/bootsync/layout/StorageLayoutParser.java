package com.dingdangmaoup.bootsync.layout;

import com.dingdangmaoup.bootsync.layout.StorageEntry.Bcache;
import com.dingdangmaoup.bootsync.layout.StorageEntry.Disk;
import com.dingdangmaoup.bootsync.layout.StorageEntry.FileSystem;
import com.dingdangmaoup.bootsync.layout.StorageEntry.LogicalVolume;
import com.dingdangmaoup.bootsync.layout.StorageEntry.Lvm;
import com.dingdangmaoup.bootsync.layout.StorageEntry.Partition;
import com.dingdangmaoup.bootsync.layout.StorageEntry.Raid;
import com.dingdangmaoup.bootsync.layout.StorageEntry.SpecialDevice;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Compiles a custom storage layout document into a {@link StorageLayout}.
 * <p>
 * The document has a {@code layout} mapping of device name to definition and a
 * {@code mounts} mapping of mount point to {@code {device, options}}. Disks with their
 * partitions, RAID arrays, LVM volume groups with their logical volumes, bcache devices
 * and special filesystems are flattened into named entries. Devices that are only
 * referenced are added as bare disks.
 */
@Slf4j
@Component
public class StorageLayoutParser {

    private static final Pattern SIZE = Pattern.compile("(-?(?:\\d+(?:\\.\\d*)?|\\.\\d+))([MGT])");
    private static final Map<String, BigDecimal> SIZE_UNITS = Map.of(
            "M", BigDecimal.TEN.pow(6),
            "G", BigDecimal.TEN.pow(9),
            "T", BigDecimal.TEN.pow(12));

    private final ObjectMapper yamlObjectMapper;
    private final StorageLayoutSchema schema;

    public StorageLayoutParser(@Qualifier("yamlObjectMapper") ObjectMapper yamlObjectMapper) {
        this.yamlObjectMapper = yamlObjectMapper;
        this.schema = StorageLayoutSchema.load();
    }

    /**
     * Parse a YAML (or JSON) layout document
     */
    public StorageLayout parseYaml(String text) {
        JsonNode document;
        try {
            document = yamlObjectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            throw new StorageConfigException("Invalid layout document: " + e.getOriginalMessage());
        }
        if (document == null || document.isMissingNode() || document.isNull()) {
            document = yamlObjectMapper.createObjectNode();
        }
        return parse(document);
    }

    public StorageLayout parse(Map<String, ?> config) {
        return parse(yamlObjectMapper.<JsonNode>valueToTree(config));
    }

    /**
     * @throws StorageConfigException if the document is invalid
     */
    public StorageLayout parse(JsonNode config) {
        schema.validate(config);

        Map<String, StorageEntry> entries = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> devices = config.get("layout").fields();
        while (devices.hasNext()) {
            Map.Entry<String, JsonNode> device = devices.next();
            for (StorageEntry entry : flatten(device.getKey(), device.getValue())) {
                if (entries.putIfAbsent(entry.getName(), entry) != null) {
                    throw new StorageConfigException("Duplicated device name '" + entry.getName() + "'");
                }
            }
        }

        Set<String> implicitDisks = new TreeSet<>();
        entries.values().forEach(entry -> implicitDisks.addAll(entry.deps()));
        implicitDisks.removeAll(entries.keySet());
        implicitDisks.forEach(name -> entries.put(name, new Disk(name)));

        setMountpoints(entries, config.get("mounts"));
        StorageLayout layout = new StorageLayout(entries, sortEntries(entries));
        log.debug("Parsed storage layout with {} entries, disks: {}", entries.size(), layout.diskNames());
        return layout;
    }

    private List<StorageEntry> flatten(String name, JsonNode device) {
        String type = device.get("type").asText();
        return switch (type) {
            case "disk" -> flattenDisk(name, device);
            case "raid" -> flattenRaid(name, device);
            case "lvm" -> flattenLvm(name, device);
            case "bcache" -> flattenBcache(name, device);
            case "special" -> flattenSpecial(name, device);
            default -> throw new StorageConfigException("Unsupported device type '" + type + "'");
        };
    }

    private List<StorageEntry> flattenDisk(String name, JsonNode device) {
        PartitionTableType ptable = device.hasNonNull("ptable")
                ? PartitionTableType.fromValue(device.get("ptable").asText())
                : null;
        JsonNode partitions = device.path("partitions");
        if (partitions.size() > 0 && ptable == null) {
            throw new StorageConfigException("Partition table not specified for '" + name + "'");
        }

        List<StorageEntry> entries = new ArrayList<>();
        entries.add(new Disk(name, ptable, device.path("boot").asBoolean(false)));
        addFilesystem(entries, name, device);

        String previous = null;
        for (JsonNode partition : partitions) {
            String partitionName = partition.get("name").asText();
            entries.add(Partition.builder()
                    .name(partitionName)
                    .on(name)
                    .size(parseSize(partition.get("size").asText()))
                    .bootable(partition.path("bootable").asBoolean(false))
                    .after(previous)
                    .build());
            addFilesystem(entries, partitionName, partition);
            previous = partitionName;
        }
        return entries;
    }

    private List<StorageEntry> flattenRaid(String name, JsonNode device) {
        int level = device.get("level").asInt();
        List<String> members = names(device.get("members"));
        List<String> spares = names(device.path("spares"));
        if (level == 0 && !spares.isEmpty()) {
            throw new StorageConfigException("RAID level 0 doesn't support spares");
        }
        Set<String> overlap = new HashSet<>(members);
        overlap.retainAll(spares);
        if (!overlap.isEmpty()) {
            throw new StorageConfigException("RAID '" + name + "' has duplicated devices in members and spares");
        }

        List<StorageEntry> entries = new ArrayList<>();
        entries.add(new Raid(name, level, members, spares));
        addFilesystem(entries, name, device);
        return entries;
    }

    private List<StorageEntry> flattenLvm(String name, JsonNode device) {
        List<StorageEntry> entries = new ArrayList<>();
        entries.add(new Lvm(name, names(device.get("members"))));
        for (JsonNode volume : device.path("volumes")) {
            String volumeName = volume.get("name").asText();
            entries.add(new LogicalVolume(volumeName, name, parseSize(volume.get("size").asText())));
            addFilesystem(entries, volumeName, volume);
        }
        return entries;
    }

    private List<StorageEntry> flattenBcache(String name, JsonNode device) {
        CacheMode cacheMode = device.hasNonNull("cache-mode")
                ? CacheMode.fromValue(device.get("cache-mode").asText())
                : null;
        List<StorageEntry> entries = new ArrayList<>();
        entries.add(new Bcache(name, device.get("backing-device").asText(), device.get("cache-device").asText(),
                cacheMode));
        addFilesystem(entries, name, device);
        return entries;
    }

    private List<StorageEntry> flattenSpecial(String name, JsonNode device) {
        String fs = device.get("fs").asText();
        FilesystemType type = FilesystemType.fromLayoutValue(fs)
                .filter(FilesystemType::isSpecial)
                .orElseThrow(() -> new StorageConfigException("Invalid special filesystem '" + fs + "'"));
        return List.of(
                new SpecialDevice(name),
                FileSystem.builder().name(StorageEntry.filesystemName(name)).on(name).type(type).build());
    }

    private void addFilesystem(List<StorageEntry> entries, String device, JsonNode definition) {
        if (!definition.hasNonNull("fs")) {
            return;
        }
        String fs = definition.get("fs").asText();
        FilesystemType type = FilesystemType.fromLayoutValue(fs)
                .filter(t -> !t.isSpecial())
                .orElseThrow(() -> new StorageConfigException("Unknown filesystem type '" + fs + "'"));
        entries.add(FileSystem.builder().name(StorageEntry.filesystemName(device)).on(device).type(type).build());
    }

    private void setMountpoints(Map<String, StorageEntry> entries, JsonNode mounts) {
        Iterator<Map.Entry<String, JsonNode>> fields = mounts.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> mount = fields.next();
            String device = mount.getValue().get("device").asText();
            String options = mount.getValue().hasNonNull("options") ? mount.getValue().get("options").asText() : null;
            String fsName = StorageEntry.filesystemName(device);
            if (!(entries.get(fsName) instanceof FileSystem fs)) {
                throw new StorageConfigException("Filesystem not found for device '" + device + "'");
            }
            entries.put(fsName, fs.withMount(mount.getKey()).withMountOptions(options));
        }

        Set<String> unmounted = new TreeSet<>();
        entries.values().forEach(entry -> {
            if (entry instanceof SpecialDevice) {
                FileSystem fs = (FileSystem) entries.get(StorageEntry.filesystemName(entry.getName()));
                if (fs.getMount() == null) {
                    unmounted.add(entry.getName());
                }
            }
        });
        if (!unmounted.isEmpty()) {
            throw new StorageConfigException("Special device(s) missing mountpoint: " + String.join(", ", unmounted));
        }
    }

    /**
     * Order entries so each one follows everything it depends on, keeping declaration
     * order otherwise. A pass that places nothing means the remaining entries form a cycle.
     */
    static List<StorageEntry> sortEntries(Map<String, StorageEntry> entries) {
        List<StorageEntry> remaining = new ArrayList<>(entries.values());
        List<StorageEntry> sorted = new ArrayList<>(remaining.size());
        Set<String> placed = new HashSet<>();
        while (!remaining.isEmpty()) {
            int before = remaining.size();
            Iterator<StorageEntry> it = remaining.iterator();
            while (it.hasNext()) {
                StorageEntry entry = it.next();
                if (placed.containsAll(entry.deps())) {
                    sorted.add(entry);
                    placed.add(entry.getName());
                    it.remove();
                }
            }
            if (remaining.size() == before) {
                Set<String> cycle = new TreeSet<>();
                remaining.forEach(entry -> cycle.add(entry.getName()));
                throw new StorageConfigException("Circular dependency between devices: " + String.join(", ", cycle));
            }
        }
        return sorted;
    }

    /**
     * Parse a decimal size such as {@code 500M}, {@code 0.5G} or {@code 3T} into bytes
     */
    public static long parseSize(String value) {
        Matcher matcher = SIZE.matcher(value);
        if (!matcher.matches()) {
            throw new StorageConfigException("Invalid size '" + value + "'");
        }
        BigDecimal number = new BigDecimal(matcher.group(1));
        if (number.signum() < 0) {
            throw new StorageConfigException("Invalid negative size '" + value + "'");
        }
        try {
            long bytes = number.multiply(SIZE_UNITS.get(matcher.group(2)))
                    .setScale(0, RoundingMode.DOWN)
                    .longValueExact();
            if (bytes == 0) {
                throw new StorageConfigException("Invalid size '" + value + "'");
            }
            return bytes;
        } catch (ArithmeticException e) {
            throw new StorageConfigException("Invalid size '" + value + "'");
        }
    }

    private static List<String> names(JsonNode array) {
        List<String> names = new ArrayList<>();
        array.forEach(item -> names.add(item.asText()));
        return names;
    }
}
