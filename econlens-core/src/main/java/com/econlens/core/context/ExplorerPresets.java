package com.econlens.core.context;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.econlens.core.model.Periodicity;
import com.econlens.core.selection.SeriesPalette;
import com.econlens.core.view.TableOrder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Explorer page presets. Built-in presets come from the classpath resource
 * {@code econlens/explorers.yaml}; a file {@code explorers.yaml} in the user
 * directory (~/.econlens, or ECONLENS_HOME) may override or add entries.
 *
 * Example:
 * <pre>
 * defaults:
 *   capacity: 5
 *   lastPeriods: 24
 *
 * explorers:
 *   cu:
 *     name: Consumer Price Index
 *     source: bls
 *     periodicity: monthly
 *     defaultSeries: [CUSR0000SA0, CUSR0000SA0L1E]
 *   nipa:
 *     source: bea
 *     periodicity: quarterly
 *     capacity: 8
 *     palette: compact
 * </pre>
 *
 * Entries inherit every field they leave unset from {@code defaults}, except
 * {@code name}, {@code survey}, {@code colors} and {@code defaultSeries}. Those
 * are per-entry only: series identifiers belong to one survey, and name and
 * survey fall back to the entry key.
 */
public class ExplorerPresets {

    private static final Logger log = LoggerFactory.getLogger(ExplorerPresets.class);

    public static final String RESOURCE = "econlens/explorers.yaml";
    private static final String CONFIG_FILE = "explorers.yaml";

    private final Map<String, ExplorerSettings> presets;

    private ExplorerPresets(Map<String, ExplorerSettings> presets) {
        this.presets = Collections.unmodifiableMap(presets);
    }

    /**
     * Built-in presets plus the user's override file, if any.
     */
    public static ExplorerPresets load() {
        return load(userDir().resolve(CONFIG_FILE));
    }

    public static ExplorerPresets load(Path overrideFile) {
        Map<String, ExplorerSettings> merged = new LinkedHashMap<>();
        try (InputStream in = ExplorerPresets.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in == null) {
                log.warn("Built-in presets {} not found on classpath", RESOURCE);
            } else {
                merged.putAll(parse(in));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read built-in presets", e);
        }

        if (overrideFile != null && Files.isRegularFile(overrideFile)) {
            try (InputStream in = Files.newInputStream(overrideFile)) {
                Map<String, ExplorerSettings> overrides = parse(in);
                merged.putAll(overrides);
                log.info("Applied {} explorer presets from {}", overrides.size(), overrideFile);
            } catch (IOException | IllegalArgumentException e) {
                log.warn("Ignoring invalid presets file {}: {}", overrideFile, e.getMessage());
            }
        } else {
            log.debug("No {} override found, using built-in presets", CONFIG_FILE);
        }
        return new ExplorerPresets(merged);
    }

    /**
     * Parse a presets document. Entries inherit unspecified fields from {@code defaults}.
     */
    public static ExplorerPresets fromYaml(InputStream in) throws IOException {
        return new ExplorerPresets(parse(in));
    }

    private static Map<String, ExplorerSettings> parse(InputStream in) throws IOException {
        ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
        yamlMapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

        ConfigFileModel config = yamlMapper.readValue(in, ConfigFileModel.class);
        Map<String, ExplorerSettings> result = new LinkedHashMap<>();
        if (config == null || config.explorers == null) {
            return result;
        }
        PresetYaml defaults = config.defaults != null ? config.defaults : new PresetYaml();
        for (Map.Entry<String, PresetYaml> entry : config.explorers.entrySet()) {
            PresetYaml yaml = entry.getValue() != null ? entry.getValue() : new PresetYaml();
            result.put(entry.getKey(), toSettings(entry.getKey(), yaml, defaults));
        }
        return result;
    }

    private static ExplorerSettings toSettings(String key, PresetYaml yaml, PresetYaml defaults) {
        ExplorerSettings.Builder b = ExplorerSettings.builder(key);
        b.name(first(yaml.name, key));
        b.source(first(yaml.source, first(defaults.source, "bls")));
        b.survey(first(yaml.survey, key));

        String periodicity = first(yaml.periodicity, defaults.periodicity);
        if (periodicity != null) {
            Periodicity p = Periodicity.fromCode(periodicity);
            if (p == null) {
                throw new IllegalArgumentException("Unknown periodicity '" + periodicity + "' for explorer " + key);
            }
            b.periodicity(p);
        }

        Integer capacity = yaml.capacity != null ? yaml.capacity : defaults.capacity;
        if (capacity != null) b.capacity(capacity);

        String palette = first(yaml.palette, defaults.palette);
        if (palette != null) b.palette(paletteFor(palette));
        if (yaml.colors != null && !yaml.colors.isEmpty()) b.palette(new SeriesPalette(yaml.colors));

        Integer lastPeriods = yaml.lastPeriods != null ? yaml.lastPeriods : defaults.lastPeriods;
        if (lastPeriods != null) b.lastPeriods(lastPeriods);

        Boolean exclude = yaml.excludeAnnualAverages != null ? yaml.excludeAnnualAverages : defaults.excludeAnnualAverages;
        if (exclude != null) b.excludeAnnualAverages(exclude);

        String order = first(yaml.tableOrder, defaults.tableOrder);
        if (order != null) b.tableOrder(TableOrder.valueOf(order.trim().toUpperCase()));

        // Per-entry only, series ids are survey specific
        if (yaml.defaultSeries != null) b.defaultSeries(yaml.defaultSeries);
        return b.build();
    }

    private static SeriesPalette paletteFor(String name) {
        return switch (name.trim().toLowerCase()) {
            case "default" -> SeriesPalette.DEFAULT;
            case "compact" -> SeriesPalette.COMPACT;
            default -> throw new IllegalArgumentException("Unknown palette: " + name);
        };
    }

    private static String first(String a, String b) {
        return a != null && !a.isBlank() ? a : b;
    }

    static Path userDir() {
        String dir = System.getProperty("econlens.home", System.getenv().get("ECONLENS_HOME"));
        if (dir != null && !dir.isBlank()) {
            return Paths.get(dir);
        }
        return Paths.get(System.getProperty("user.home"), ".econlens");
    }

    public Optional<ExplorerSettings> get(String key) {
        return Optional.ofNullable(presets.get(key));
    }

    /**
     * Preset for {@code key}, failing if there is none.
     */
    public ExplorerSettings require(String key) {
        ExplorerSettings settings = presets.get(key);
        if (settings == null) {
            throw new IllegalArgumentException("No explorer preset '" + key + "', known: " + presets.keySet());
        }
        return settings;
    }

    public Set<String> keys() {
        return presets.keySet();
    }

    public int size() {
        return presets.size();
    }

    // ===== YAML model =====

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class ConfigFileModel {
        public PresetYaml defaults;
        public Map<String, PresetYaml> explorers;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class PresetYaml {
        public String name;
        public String source;
        public String survey;
        public String periodicity;
        public Integer capacity;
        public String palette;
        public List<String> colors;
        public Integer lastPeriods;
        public Boolean excludeAnnualAverages;
        public String tableOrder;
        public List<String> defaultSeries;
    }
}
