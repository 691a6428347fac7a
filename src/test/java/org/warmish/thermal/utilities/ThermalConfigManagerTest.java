package org.warmish.thermal.utilities;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.warmish.thermal.model.CalibrationKey;
import org.warmish.thermal.service.RadiometricConverter;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ThermalConfigManagerTest {

    @TempDir
    Path tempDir;

    @Test
    void testBundledDefaults() {
        ThermalConfigManager config = ThermalConfigManager.getDefault();

        assertEquals("classpath:" + ThermalConfigManager.DEFAULT_RESOURCE, config.getSource());
        assertEquals(RadiometricConverter.DEFAULT_EMISSIVITY_FLOOR, config.getEmissivityFloor());
        assertFalse(config.isEnvironmentalCorrectionEnabled());
        assertEquals(0.95, config.getDefaultRoiEmissivity());
        assertEquals(50, config.getInteger("roi", "import_defaults", "width"));
        assertSame(config, ThermalConfigManager.getDefault());
    }

    @Test
    void testCalibrationDefaults_EnvironmentalOnly() {
        Map<CalibrationKey, Double> defaults = ThermalConfigManager.getDefault().getCalibrationDefaults();

        assertEquals(6, defaults.size());
        assertEquals(20.0, defaults.get(CalibrationKey.REFLECTED_APPARENT_TEMPERATURE));
        assertTrue(defaults.keySet().stream().noneMatch(CalibrationKey::isCameraConstant));
    }

    @Test
    void testCalibrationDefaults_IgnoreCameraConstantsAndUnknownKeys() {
        ThermalConfigManager config = ThermalConfigManager.fromMap(Map.of("calibration_defaults",
                Map.of("PlanckR1", 1000.0, "Humidity", 40.0, "RelativeHumidity", "35")));

        Map<CalibrationKey, Double> defaults = config.getCalibrationDefaults();

        assertEquals(Map.of(CalibrationKey.RELATIVE_HUMIDITY, 35.0), defaults);
    }

    @Test
    void testFromFile() throws IOException {
        Path file = tempDir.resolve("thermal.yml");
        Files.writeString(file, """
                conversion:
                  emissivity_floor: 0.01
                  environmental_correction: "true"
                roi:
                  color:
                    hue_step: 30
                """);

        ThermalConfigManager config = ThermalConfigManager.fromFile(file);

        assertEquals(0.01, config.getEmissivityFloor());
        assertTrue(config.isEnvironmentalCorrectionEnabled());
        assertTrue(config.createConverter().isEnvironmentalCorrection());
        assertEquals(30, config.getIntegerOrDefault(55, "roi", "color", "hue_step"));
        assertEquals(220, config.getIntegerOrDefault(220, "roi", "color", "saturation"));
        assertEquals(0.95, config.getDefaultRoiEmissivity());
    }

    @Test
    void testMissingOrBrokenFile_EmptyConfig() throws IOException {
        ThermalConfigManager missing = ThermalConfigManager.fromFile(tempDir.resolve("nope.yml"));
        Path broken = tempDir.resolve("broken.yml");
        Files.writeString(broken, "roi: [unclosed");

        assertTrue(missing.getAllConfig().isEmpty());
        assertTrue(ThermalConfigManager.fromFile(broken).getAllConfig().isEmpty());
        assertTrue(ThermalConfigManager.fromClasspath("no_such_file.yml").getAllConfig().isEmpty());
    }

    @Test
    void testTypedGetters_WrongTypes() {
        ThermalConfigManager config = ThermalConfigManager.fromMap(Map.of("a",
                Map.of("text", "hello", "flag", 3, "number", " 12 ")));

        assertNull(config.getInteger("a", "text"));
        assertNull(config.getBoolean("a", "flag"));
        assertEquals(12, config.getInteger("a", "number"));
        assertEquals(12.0, config.getDouble("a", "number"));
        assertNull(config.getConfigItem("a", "text", "deeper"));
        assertTrue(config.getSection("a", "missing").isEmpty());
        assertEquals(1.5, config.getDoubleOrDefault(1.5, "b"));
    }
}
