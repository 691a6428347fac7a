package org.warmish.thermal.utilities;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.warmish.thermal.model.CalibrationKey;
import org.warmish.thermal.model.CalibrationParameters;
import org.warmish.thermal.service.InvalidCalibrationException;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Builds {@link CalibrationParameters} from a flat camera metadata map.
 *
 * <p>For each recognised parameter the reader looks up {@code "APP1:" + key} first, then the
 * bare key. Values may be numbers or numeric strings. A missing entry, {@code "N/A"} or an
 * unparsable string falls back to, in order:</p>
 * <ol>
 *   <li>the previously known value, when one is supplied and finite;</li>
 *   <li>the documented default from {@link ThermalConfigManager#getCalibrationDefaults()}.</li>
 * </ol>
 * <p>Planck constants have no documented default. If neither the metadata nor the previous
 * calibration has them they stay missing and the result is not {@link CalibrationParameters#isValid() valid}.</p>
 *
 * <p>User edits go through {@link #readEdits(Map, CalibrationParameters)} instead, which
 * rejects a supplied value that is not a finite number rather than falling back.</p>
 */
public class CalibrationParameterReader {
    private static final Logger logger = LoggerFactory.getLogger(CalibrationParameterReader.class);

    static final String METADATA_PREFIX = "APP1:";
    private static final String NOT_AVAILABLE = "N/A";

    private final Map<CalibrationKey, Double> defaults;

    public CalibrationParameterReader() {
        this(ThermalConfigManager.getDefault());
    }

    public CalibrationParameterReader(ThermalConfigManager config) {
        this.defaults = new EnumMap<>(CalibrationKey.class);
        this.defaults.putAll(config.getCalibrationDefaults());
    }

    public CalibrationParameters read(Map<String, ?> metadata) {
        return read(metadata, null);
    }

    /**
     * @param metadata flat key to value map from the metadata collaborator, may be null
     * @param previous last known calibration, may be null
     */
    public CalibrationParameters read(Map<String, ?> metadata, CalibrationParameters previous) {
        CalibrationParameters.Builder builder = new CalibrationParameters.Builder();
        int fromMetadata = 0;
        for (CalibrationKey key : CalibrationKey.values()) {
            Double value = lookup(metadata, key);
            if (value != null) {
                fromMetadata++;
            } else if (previous != null && Double.isFinite(previous.get(key))) {
                value = previous.get(key);
                logger.debug("{} not in metadata, keeping previous value {}", key.getKey(), value);
            } else if (defaults.containsKey(key)) {
                value = defaults.get(key);
                logger.debug("{} not in metadata, using default {}", key.getKey(), value);
            } else {
                logger.warn("No value available for calibration parameter {}", key.getKey());
                value = Double.NaN;
            }
            builder.set(key, value);
        }
        logger.info("Read {} of {} calibration parameters from metadata", fromMetadata, CalibrationKey.values().length);
        return builder.build();
    }

    /**
     * Applies user edits on top of {@code previous}. Parameters not named in {@code edits}
     * keep their previous value; unknown keys are logged and ignored.
     *
     * @throws InvalidCalibrationException naming every recognised key whose supplied value is
     *                                     not a finite number
     */
    public CalibrationParameters readEdits(Map<String, ?> edits, CalibrationParameters previous)
            throws InvalidCalibrationException {
        List<String> rejected = new ArrayList<>();
        if (edits != null) {
            for (Map.Entry<String, ?> entry : edits.entrySet()) {
                String name = entry.getKey().startsWith(METADATA_PREFIX)
                        ? entry.getKey().substring(METADATA_PREFIX.length())
                        : entry.getKey();
                CalibrationKey key = CalibrationKey.fromKey(name);
                if (key == null) {
                    logger.warn("Ignoring edit of unknown calibration parameter '{}'", entry.getKey());
                    continue;
                }
                if (parse(entry.getValue(), key) == null) {
                    rejected.add(key.getKey());
                }
            }
        }
        if (!rejected.isEmpty()) {
            logger.warn("Rejected calibration edits with non-numeric values: {}", rejected);
            throw new InvalidCalibrationException(rejected);
        }
        return read(edits, previous);
    }

    private Double lookup(Map<String, ?> metadata, CalibrationKey key) {
        if (metadata == null) {
            return null;
        }
        Object raw = metadata.get(METADATA_PREFIX + key.getKey());
        if (raw == null) {
            raw = metadata.get(key.getKey());
        }
        return parse(raw, key);
    }

    private Double parse(Object raw, CalibrationKey key) {
        if (raw == null) {
            return null;
        }
        if (raw instanceof Number n) {
            double v = n.doubleValue();
            return Double.isFinite(v) ? v : null;
        }
        String text = raw.toString().trim();
        if (text.isEmpty() || NOT_AVAILABLE.equalsIgnoreCase(text)) {
            return null;
        }
        try {
            double v = Double.parseDouble(text);
            return Double.isFinite(v) ? v : null;
        } catch (NumberFormatException e) {
            logger.warn("Ignoring non-numeric metadata value '{}' for {}", text, key.getKey());
            return null;
        }
    }
}
