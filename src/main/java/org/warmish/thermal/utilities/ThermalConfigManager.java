package org.warmish.thermal.utilities;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.warmish.thermal.model.CalibrationKey;
import org.warmish.thermal.service.RadiometricConverter;
import org.yaml.snakeyaml.Yaml;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * ThermalConfigManager
 *
 * <p>Loads and queries the YAML configuration of the thermal core:
 *   - {@code conversion}: emissivity floor and the environmental correction switch.
 *   - {@code calibration_defaults}: fallbacks for environmental calibration parameters.
 *   - {@code roi}: default emissivity, colour cycle and import geometry defaults.</p>
 *
 * <p>A missing or unparsable file is logged and yields an empty configuration, so every
 * typed getter falls back to its code default.</p>
 */
public class ThermalConfigManager {
    private static final Logger logger = LoggerFactory.getLogger(ThermalConfigManager.class);

    public static final String DEFAULT_RESOURCE = "thermal_defaults.yml";

    private static ThermalConfigManager defaultInstance;

    private final Map<String, Object> configData;
    private final String source;

    private ThermalConfigManager(Map<String, Object> configData, String source) {
        this.configData = configData;
        this.source = source;
        logger.debug("Loaded configuration from {} with sections {}", source, configData.keySet());
    }

    /**
     * Shared instance backed by {@value #DEFAULT_RESOURCE} on the classpath.
     */
    public static synchronized ThermalConfigManager getDefault() {
        if (defaultInstance == null) {
            defaultInstance = fromClasspath(DEFAULT_RESOURCE);
        }
        return defaultInstance;
    }

    public static ThermalConfigManager fromClasspath(String resource) {
        try (InputStream in = ThermalConfigManager.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                logger.error("YAML resource not found on classpath: {}", resource);
                return new ThermalConfigManager(new LinkedHashMap<>(), "classpath:" + resource);
            }
            return new ThermalConfigManager(parse(in, resource), "classpath:" + resource);
        } catch (IOException e) {
            logger.error("Error reading YAML resource: {}", resource, e);
            return new ThermalConfigManager(new LinkedHashMap<>(), "classpath:" + resource);
        }
    }

    public static ThermalConfigManager fromFile(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            return new ThermalConfigManager(parse(in, path.toString()), path.toString());
        } catch (NoSuchFileException | FileNotFoundException e) {
            logger.error("YAML file not found: {}", path, e);
        } catch (IOException e) {
            logger.error("Error reading YAML: {}", path, e);
        }
        return new ThermalConfigManager(new LinkedHashMap<>(), path.toString());
    }

    /**
     * Configuration over an in-memory map, e.g. one assembled by a settings dialog.
     */
    public static ThermalConfigManager fromMap(Map<String, Object> data) {
        return new ThermalConfigManager(new LinkedHashMap<>(data == null ? Map.of() : data), "memory");
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> parse(InputStream in, String name) {
        Yaml yaml = new Yaml();
        try {
            Object loaded = yaml.load(in);
            if (loaded instanceof Map) {
                return new LinkedHashMap<>((Map<String, Object>) loaded);
            } else if (loaded == null) {
                logger.warn("YAML document is empty: {}", name);
            } else {
                logger.error("YAML root is not a map: {}", name);
            }
        } catch (RuntimeException e) {
            logger.error("Error parsing YAML: {}", name, e);
        }
        return new LinkedHashMap<>();
    }

    public Map<String, Object> getAllConfig() {
        return Collections.unmodifiableMap(configData);
    }

    public String getSource() {
        return source;
    }

    /**
     * Walks nested maps by key.
     *
     * @return the value at the path, or null if any key is missing
     */
    public Object getConfigItem(String... keys) {
        Object current = configData;
        for (int i = 0; i < keys.length; i++) {
            if (current instanceof Map<?, ?> map && map.containsKey(keys[i])) {
                current = map.get(keys[i]);
                continue;
            }
            logger.debug("Config key '{}' not found at level {} of {}", keys[i], i, Arrays.toString(keys));
            return null;
        }
        return current;
    }

    public String getString(String... keys) {
        Object v = getConfigItem(keys);
        return v != null ? v.toString() : null;
    }

    public Integer getInteger(String... keys) {
        Object v = getConfigItem(keys);
        if (v instanceof Number n) return n.intValue();
        try {
            return v != null ? Integer.parseInt(v.toString().trim()) : null;
        } catch (NumberFormatException e) {
            logger.warn("Expected int at {} but got {}", String.join("/", keys), v);
            return null;
        }
    }

    public Double getDouble(String... keys) {
        Object v = getConfigItem(keys);
        if (v instanceof Number n) return n.doubleValue();
        try {
            return v != null ? Double.parseDouble(v.toString().trim()) : null;
        } catch (NumberFormatException e) {
            logger.warn("Expected double at {} but got {}", String.join("/", keys), v);
            return null;
        }
    }

    public Boolean getBoolean(String... keys) {
        Object v = getConfigItem(keys);
        if (v instanceof Boolean b) return b;
        if (v instanceof String s && (s.equalsIgnoreCase("true") || s.equalsIgnoreCase("false"))) {
            return Boolean.parseBoolean(s);
        }
        if (v != null) {
            logger.warn("Expected boolean at {} but got {}", String.join("/", keys), v);
        }
        return null;
    }

    public double getDoubleOrDefault(double fallback, String... keys) {
        Double v = getDouble(keys);
        return v != null ? v : fallback;
    }

    public int getIntegerOrDefault(int fallback, String... keys) {
        Integer v = getInteger(keys);
        return v != null ? v : fallback;
    }

    public boolean getBooleanOrDefault(boolean fallback, String... keys) {
        Boolean v = getBoolean(keys);
        return v != null ? v : fallback;
    }

    /**
     * @return the nested map at the path, or an empty map
     */
    @SuppressWarnings("unchecked")
    public Map<String, Object> getSection(String... keys) {
        Object v = getConfigItem(keys);
        if (v instanceof Map<?, ?>) {
            return Collections.unmodifiableMap((Map<String, Object>) v);
        }
        return Collections.emptyMap();
    }

    public double getEmissivityFloor() {
        return getDoubleOrDefault(RadiometricConverter.DEFAULT_EMISSIVITY_FLOOR, "conversion", "emissivity_floor");
    }

    public boolean isEnvironmentalCorrectionEnabled() {
        return getBooleanOrDefault(false, "conversion", "environmental_correction");
    }

    /**
     * Converter configured with this file's conversion settings.
     */
    public RadiometricConverter createConverter() {
        return new RadiometricConverter(getEmissivityFloor(), isEnvironmentalCorrectionEnabled());
    }

    /**
     * Documented defaults for the environmental calibration parameters. Camera constants never
     * have a default and are not included even if the file lists them.
     */
    public Map<CalibrationKey, Double> getCalibrationDefaults() {
        Map<CalibrationKey, Double> defaults = new EnumMap<>(CalibrationKey.class);
        for (Map.Entry<String, Object> entry : getSection("calibration_defaults").entrySet()) {
            CalibrationKey key = CalibrationKey.fromKey(entry.getKey());
            if (key == null) {
                logger.warn("Unknown calibration default '{}' in {}", entry.getKey(), source);
                continue;
            }
            if (key.isCameraConstant()) {
                logger.warn("Ignoring default for camera constant {} in {}", key.getKey(), source);
                continue;
            }
            Double value = getDouble("calibration_defaults", entry.getKey());
            if (value != null) {
                defaults.put(key, value);
            }
        }
        return defaults;
    }

    public double getDefaultRoiEmissivity() {
        return getDoubleOrDefault(0.95, "roi", "default_emissivity");
    }
}
