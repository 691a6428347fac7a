package org.warmish.thermal.controller;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.warmish.thermal.ThermalTestData;
import org.warmish.thermal.model.CalibrationKey;
import org.warmish.thermal.model.CalibrationParameters;
import org.warmish.thermal.model.EventBus;
import org.warmish.thermal.model.RoiEvent;
import org.warmish.thermal.model.StatisticsRecord;
import org.warmish.thermal.model.TemperatureField;
import org.warmish.thermal.roi.GeometryUpdate;
import org.warmish.thermal.roi.PolygonRoi;
import org.warmish.thermal.roi.RectangleRoi;
import org.warmish.thermal.roi.Roi;
import org.warmish.thermal.roi.RoiMask;
import org.warmish.thermal.roi.RoiProperty;
import org.warmish.thermal.roi.RoiType;
import org.warmish.thermal.roi.SpotRoi;
import org.warmish.thermal.service.RadiometricConverter;
import org.warmish.thermal.utilities.RoiRecord;
import org.warmish.thermal.utilities.RoiReport;
import org.warmish.thermal.utilities.ThermalConfigManager;

import java.awt.Color;
import java.awt.geom.Point2D;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.Mockito.*;

class RoiControllerTest {
    private static final int SIZE = 20;
    private static final int RAW = ThermalTestData.roundedRawFor(30.0);

    private EventBus bus;
    private ThermalEngine engine;
    private RoiController controller;
    private CalibrationParameters params;
    private final List<RoiEvent> events = new ArrayList<>();

    @BeforeEach
    void setUp() {
        bus = new EventBus();
        engine = new ThermalEngine(bus);
        controller = new RoiController(engine, ThermalConfigManager.getDefault());
        params = ThermalTestData.calibration(0.95);
        engine.loadFrame(ThermalTestData.uniformFrame(SIZE, SIZE, RAW), params);
        engine.calculateTemperatures();
        bus.subscribe(RoiEvent.class, events::add);
    }

    private double expectedCelsius(double emissivity) {
        return new RadiometricConverter().toCelsius(new double[]{RAW}, params, emissivity)[0];
    }

    private long count(RoiEvent.Type type) {
        return events.stream().filter(e -> e.type() == type).count();
    }

    private Map<UUID, Integer> countStatisticsUpdates() {
        Map<UUID, Integer> counts = new HashMap<>();
        for (RoiEvent event : events) {
            if (event.type() == RoiEvent.Type.STATISTICS_UPDATED) {
                counts.merge(event.roiId(), 1, Integer::sum);
            }
        }
        return counts;
    }

    @Nested
    class Creation {

        @Test
        void testNames_SharedCounterAcrossShapes() {
            Roi first = controller.createRectangle(0, 0, 5, 5);
            Roi second = controller.createSpot(10, 10, 2);
            Roi named = controller.createRectangle(1, 1, 2, 2, "Hot corner", null);
            Roi third = controller.createPolygon(List.of(
                    new Point2D.Double(0, 0), new Point2D.Double(4, 0), new Point2D.Double(4, 4)));

            assertEquals("ROI_1", first.getName());
            assertEquals("Spot_2", second.getName());
            assertEquals("Hot corner", named.getName());
            assertEquals("Polygon_3", third.getName());
        }

        @Test
        void testDeleteAll_RestartsNaming() {
            controller.createRectangle(0, 0, 5, 5);
            controller.createRectangle(0, 0, 5, 5);

            assertEquals(2, controller.deleteAll());

            assertEquals(0, controller.size());
            assertEquals("ROI_1", controller.createRectangle(0, 0, 5, 5).getName());
            assertEquals(1, count(RoiEvent.Type.CLEARED));
        }

        @Test
        void testColors_FollowCreationIndex() {
            Roi first = controller.createRectangle(0, 0, 5, 5);
            Roi second = controller.createSpot(5, 5, 1);

            assertEquals(Color.getHSBColor(0f, 220 / 255f, 1f), first.getColor());
            assertEquals(Color.getHSBColor(55 / 360f, 220 / 255f, 1f), second.getColor());
        }

        @Test
        void testCreate_ComputesStatisticsThenAnnounces() {
            Roi roi = controller.createRectangle(2, 2, 4, 3);

            StatisticsRecord stats = roi.getStatistics();
            assertTrue(stats.isPresent());
            assertEquals(12, stats.getSampleCount());
            assertEquals(expectedCelsius(Roi.DEFAULT_EMISSIVITY), stats.getMean().getAsDouble(), 1e-9);
            assertEquals(0.0, stats.getStd().getAsDouble(), 1e-9);
            assertEquals(List.of(RoiEvent.Type.STATISTICS_UPDATED, RoiEvent.Type.ADDED),
                    events.stream().map(RoiEvent::type).toList());
        }

        @Test
        void testCreate_EmissivityOverride() {
            Roi roi = controller.createSpot(10, 10, 3, null, 0.7);

            assertEquals(0.7, roi.getEmissivity());
            assertEquals(expectedCelsius(0.7), roi.getStatistics().getMean().getAsDouble(), 1e-9);
        }

        @Test
        void testCreate_InvalidGeometryRegistersNothing() {
            assertThrows(IllegalArgumentException.class, () -> controller.createSpot(1, 1, -2));
            assertThrows(IllegalArgumentException.class, () -> controller.createRectangle(0, 0, 5, 5, null, 1.5));

            assertEquals(0, controller.size());
            assertTrue(events.isEmpty());
            assertEquals("ROI_1", controller.createRectangle(0, 0, 1, 1).getName());
        }

        @Test
        void testCreate_BeforeAnyTemperatures() {
            RoiController fresh = new RoiController(new ThermalEngine(new EventBus()));

            Roi roi = fresh.createRectangle(0, 0, 5, 5);

            assertFalse(roi.getStatistics().isPresent());
            assertEquals(0, fresh.getPixelCount(roi.getId()));
        }
    }

    @Nested
    class Coverage {

        @Test
        void testOutsideImage_EmptyStatistics() {
            Roi roi = controller.createRectangle(100, 100, 10, 10);

            assertFalse(roi.getStatistics().isPresent());
            assertEquals(0, controller.getPixelCount(roi.getId()));
        }

        @Test
        void testZeroWidthRectangle_EmptyStatistics() {
            Roi roi = controller.createRectangle(5, 5, 0, 4);

            assertFalse(roi.getStatistics().isPresent());
        }

        @Test
        void testPartiallyOutside_Clipped() {
            Roi roi = controller.createRectangle(15, 15, 10, 10);

            assertEquals(25, controller.getPixelCount(roi.getId()));
            assertEquals(25, roi.getStatistics().getSampleCount());
        }

        @Test
        @DisplayName("A mask that cannot be built degrades only its own ROI")
        void testMaskFailure_OnlyAffectsThatRoi() {
            Roi broken = controller.createRectangle(Double.MAX_VALUE, 0, Double.MAX_VALUE, 5);
            Roi healthy = controller.createRectangle(0, 0, 5, 5);

            assertFalse(broken.getStatistics().isPresent());
            assertTrue(healthy.getStatistics().isPresent());
            assertEquals(0, controller.getPixelCount(broken.getId()));
            assertEquals(2, controller.size());
        }

        @Test
        void testUnexpectedFailure_IsContained() {
            ThermalEngine failing = mock(ThermalEngine.class);
            when(failing.getEventBus()).thenReturn(new EventBus());
            when(failing.getTemperatureField()).thenReturn(Optional.of(TemperatureField.of(10, 10, new double[100])));
            when(failing.computeRoiTemperatures(any(RoiMask.class), anyDouble()))
                    .thenThrow(new IllegalStateException("sensor gone"));
            RoiController guarded = new RoiController(failing, ThermalConfigManager.getDefault());

            Roi roi = guarded.createRectangle(0, 0, 5, 5);

            assertFalse(roi.getStatistics().isPresent());
            assertFalse(guarded.isUpdating());
            assertEquals(1, guarded.size());
        }
    }

    @Nested
    class Edits {

        @Test
        void testEmissivityUpdate_Recomputes() {
            Roi roi = controller.createRectangle(0, 0, 5, 5);
            events.clear();

            assertTrue(controller.updateProperty(roi.getId(), RoiProperty.EMISSIVITY, 0.8));

            assertEquals(0.8, roi.getEmissivity());
            assertEquals(expectedCelsius(0.8), roi.getStatistics().getMean().getAsDouble(), 1e-9);
            assertEquals(List.of(RoiEvent.Type.STATISTICS_UPDATED, RoiEvent.Type.MODIFIED),
                    events.stream().map(RoiEvent::type).toList());
        }

        @Test
        void testNameAndColorUpdate_DoNotRecompute() {
            Roi roi = controller.createRectangle(0, 0, 5, 5);
            StatisticsRecord before = roi.getStatistics();
            events.clear();

            controller.updateProperty(roi.getId(), RoiProperty.NAME, "Bearing");
            controller.updateProperty(roi.getId(), RoiProperty.COLOR, Color.GREEN);

            assertEquals("Bearing", roi.getName());
            assertEquals(Color.GREEN, roi.getColor());
            assertSame(before, roi.getStatistics());
            assertEquals(0, count(RoiEvent.Type.STATISTICS_UPDATED));
            assertEquals(2, count(RoiEvent.Type.MODIFIED));
        }

        @Test
        void testPropertyUpdate_Validation() {
            Roi roi = controller.createRectangle(0, 0, 5, 5);

            assertThrows(IllegalArgumentException.class,
                    () -> controller.updateProperty(roi.getId(), RoiProperty.EMISSIVITY, "0.5"));
            assertThrows(IllegalArgumentException.class,
                    () -> controller.updateProperty(roi.getId(), RoiProperty.EMISSIVITY, 1.2));
            assertThrows(IllegalArgumentException.class,
                    () -> controller.updateProperty(roi.getId(), RoiProperty.NAME, ""));
            assertEquals(Roi.DEFAULT_EMISSIVITY, roi.getEmissivity());
            assertFalse(controller.updateProperty(UUID.randomUUID(), RoiProperty.NAME, "x"));
        }

        @Test
        void testGeometryUpdate_MovesAndRecomputes() {
            Roi roi = controller.createRectangle(0, 0, 5, 5);

            assertTrue(controller.updateGeometry(roi.getId(), new GeometryUpdate.Builder().x(50).build()));

            assertEquals(50.0, ((RectangleRoi) roi).getX());
            assertFalse(roi.getStatistics().isPresent());
        }

        @Test
        void testGeometryUpdate_NothingApplicable() {
            Roi roi = controller.createRectangle(0, 0, 5, 5);
            StatisticsRecord before = roi.getStatistics();
            events.clear();

            assertFalse(controller.updateGeometry(roi.getId(), new GeometryUpdate.Builder().radius(3).build()));
            assertFalse(controller.updateGeometry(roi.getId(), new GeometryUpdate.Builder().build()));

            assertSame(before, roi.getStatistics());
            assertTrue(events.isEmpty());
        }

        @Test
        void testDelete_LeavesOthersAlone() {
            Roi keep = controller.createRectangle(0, 0, 5, 5);
            Roi drop = controller.createSpot(10, 10, 2);
            StatisticsRecord kept = keep.getStatistics();

            assertTrue(controller.delete(drop.getId()));
            assertFalse(controller.delete(drop.getId()));

            assertSame(kept, keep.getStatistics());
            assertEquals(List.of(keep), controller.getRois());
            assertTrue(controller.getRoi(drop.getId()).isEmpty());
            assertEquals(1, count(RoiEvent.Type.REMOVED));
        }

        @Test
        void testDelete_Collection() {
            Roi a = controller.createRectangle(0, 0, 5, 5);
            Roi b = controller.createRectangle(0, 0, 5, 5);
            controller.createRectangle(0, 0, 5, 5);

            assertEquals(2, controller.delete(List.of(a.getId(), b.getId(), UUID.randomUUID())));
            assertEquals(1, controller.size());
        }
    }

    @Nested
    class RecomputeProtocol {

        @Test
        @DisplayName("Two ROIs requesting each other are each computed once")
        void testMutualRequests_Terminate() {
            Roi a = controller.createRectangle(0, 0, 5, 5);
            Roi b = controller.createRectangle(5, 5, 5, 5);
            events.clear();
            List<Boolean> guardSeen = new ArrayList<>();
            bus.subscribe(RoiEvent.class, e -> {
                if (e.type() == RoiEvent.Type.STATISTICS_UPDATED) {
                    guardSeen.add(controller.isUpdating());
                    controller.requestRecompute(e.roiId().equals(a.getId()) ? b.getId() : a.getId());
                }
            });

            controller.requestRecompute(a.getId());

            assertEquals(Map.of(a.getId(), 1, b.getId(), 1), countStatisticsUpdates());
            assertEquals(List.of(true, true), guardSeen);
            assertFalse(controller.isUpdating());
            assertTrue(controller.getPendingIds().isEmpty());
        }

        @Test
        void testSelfRequest_Dropped() {
            Roi a = controller.createRectangle(0, 0, 5, 5);
            events.clear();
            bus.subscribe(RoiEvent.class, e -> {
                if (e.type() == RoiEvent.Type.STATISTICS_UPDATED) {
                    controller.requestRecompute(e.roiId());
                }
            });

            controller.requestRecompute(a.getId());

            assertEquals(Map.of(a.getId(), 1), countStatisticsUpdates());
            assertTrue(controller.getPendingIds().isEmpty());
        }

        @Test
        void testFanOut_EveryRoiOnce() {
            List<UUID> ids = new ArrayList<>();
            for (int i = 0; i < 30; i++) {
                ids.add(controller.createRectangle(i % SIZE, 0, 1, 1).getId());
            }
            events.clear();
            bus.subscribe(RoiEvent.class, e -> {
                if (e.type() == RoiEvent.Type.STATISTICS_UPDATED) {
                    ids.forEach(controller::requestRecompute);
                }
            });

            controller.requestRecompute(ids.get(0));

            Map<UUID, Integer> counts = countStatisticsUpdates();
            assertEquals(30, counts.size());
            assertTrue(counts.values().stream().allMatch(c -> c == 1));
            assertFalse(controller.isUpdating());
        }

        @Test
        @DisplayName("An emissivity edit made by a subscriber mid-batch is not lost")
        void testEditDuringBatch_Recomputed() {
            Roi a = controller.createRectangle(0, 0, 5, 5);
            Roi b = controller.createRectangle(5, 5, 5, 5);
            events.clear();
            AtomicBoolean askedForB = new AtomicBoolean();
            AtomicBoolean editedA = new AtomicBoolean();
            bus.subscribe(RoiEvent.class, e -> {
                if (e.type() != RoiEvent.Type.STATISTICS_UPDATED) {
                    return;
                }
                if (e.roiId().equals(a.getId()) && askedForB.compareAndSet(false, true)) {
                    controller.requestRecompute(b.getId());
                } else if (e.roiId().equals(b.getId()) && editedA.compareAndSet(false, true)) {
                    controller.updateProperty(a.getId(), RoiProperty.EMISSIVITY, 0.8);
                }
            });

            controller.requestRecompute(a.getId());

            assertEquals(Map.of(a.getId(), 2, b.getId(), 1), countStatisticsUpdates());
            assertEquals(expectedCelsius(0.8), a.getStatistics().getMean().getAsDouble(), 1e-9);
        }

        @Test
        @DisplayName("A ROI edited by a subscriber to its own update is recomputed with the edit")
        void testSelfEditDuringUpdate_Recomputed() {
            Roi a = controller.createRectangle(0, 0, 5, 5);
            events.clear();
            AtomicBoolean edited = new AtomicBoolean();
            bus.subscribe(RoiEvent.class, e -> {
                if (e.type() == RoiEvent.Type.STATISTICS_UPDATED && e.roiId().equals(a.getId())
                        && edited.compareAndSet(false, true)) {
                    controller.updateProperty(a.getId(), RoiProperty.EMISSIVITY, 0.5);
                }
            });

            controller.requestRecompute(a.getId());

            assertEquals(0.5, a.getEmissivity());
            assertEquals(expectedCelsius(0.5), a.getStatistics().getMean().getAsDouble(), 1e-9);
            assertEquals(Map.of(a.getId(), 2), countStatisticsUpdates());
            assertFalse(controller.isUpdating());
            assertTrue(controller.getPendingIds().isEmpty());
        }

        @Test
        void testSelfGeometryEditDuringUpdate_Recomputed() {
            Roi a = controller.createRectangle(0, 0, 5, 5);
            AtomicBoolean moved = new AtomicBoolean();
            bus.subscribe(RoiEvent.class, e -> {
                if (e.type() == RoiEvent.Type.STATISTICS_UPDATED && e.roiId().equals(a.getId())
                        && moved.compareAndSet(false, true)) {
                    controller.updateGeometry(a.getId(), new GeometryUpdate.Builder().x(100).build());
                }
            });

            controller.requestRecompute(a.getId());

            assertEquals(100.0, ((RectangleRoi) a).getX());
            assertFalse(a.getStatistics().isPresent());
        }

        @Test
        void testUnknownId_Ignored() {
            controller.requestRecompute(UUID.randomUUID());
            controller.requestRecompute(null);

            assertTrue(events.isEmpty());
        }

        @Test
        void testRecomputeAll_SingleAnalysisEvent() {
            controller.createRectangle(0, 0, 5, 5);
            controller.createSpot(10, 10, 3);
            events.clear();

            controller.recomputeAll();

            assertEquals(1, events.size());
            assertEquals(RoiEvent.Type.ANALYSIS_UPDATED, events.get(0).type());
            assertNull(events.get(0).roiId());
        }

        @Test
        void testRecalculate_NewCalibrationRefreshesEveryRoi() {
            Roi roi = controller.createRectangle(0, 0, 5, 5);
            double before = roi.getStatistics().getMean().getAsDouble();

            params = ThermalTestData.calibration(0.95).toBuilder().reflectedApparentTemperature(0.0).build();
            assertTrue(controller.recalculate(params));

            double after = roi.getStatistics().getMean().getAsDouble();
            assertNotEquals(before, after);
            assertEquals(expectedCelsius(Roi.DEFAULT_EMISSIVITY), after, 1e-9);
        }

        @Test
        void testRecalculate_InvalidCalibrationEmptiesStatistics() {
            Roi roi = controller.createRectangle(0, 0, 5, 5);
            CalibrationParameters broken = params.toBuilder().set(CalibrationKey.PLANCK_B, Double.NaN).build();

            assertFalse(controller.recalculate(broken));

            assertFalse(roi.getStatistics().isPresent());
            assertEquals(1, count(RoiEvent.Type.ANALYSIS_UPDATED));
        }
    }

    @Nested
    class ExportImport {

        @Test
        void testRoundTrip_AllShapes() {
            controller.createRectangle(1, 2, 3, 4, "r", 0.9);
            controller.createSpot(5, 6, 2, "s", null);
            controller.createPolygon(List.of(new Point2D.Double(0, 0), new Point2D.Double(8, 0),
                    new Point2D.Double(4, 6)), "p", 0.5);
            RoiController copy = new RoiController(engine, ThermalConfigManager.getDefault());

            assertEquals(3, copy.importRois(controller.exportRois()));

            List<Roi> rois = copy.getRois();
            RectangleRoi rect = (RectangleRoi) rois.get(0);
            assertEquals("r", rect.getName());
            assertEquals(0.9, rect.getEmissivity());
            assertEquals(3.0, rect.getWidth());
            assertEquals(4.0, rect.getHeight());
            SpotRoi spot = (SpotRoi) rois.get(1);
            assertEquals(6.0, spot.getCenterY());
            assertEquals(2.0, spot.getRadius());
            PolygonRoi poly = (PolygonRoi) rois.get(2);
            assertEquals(3, poly.getVertexCount());
            assertEquals(new Point2D.Double(4, 6), poly.getVertices().get(2));
            assertTrue(rect.getStatistics().isPresent());
        }

        @Test
        @DisplayName("Legacy labels and missing fields fall back to the import defaults")
        void testImport_LegacyLabelsAndDefaults() {
            RoiRecord rect = new RoiRecord();
            rect.setType("RectROI");
            RoiRecord spot = new RoiRecord();
            spot.setType("SpotROI");
            spot.setX(10.0);
            RoiRecord poly = new RoiRecord();
            poly.setType("PolygonROI");

            assertEquals(3, controller.importRois(List.of(rect, spot, poly)));

            List<Roi> rois = controller.getRois();
            RectangleRoi importedRect = (RectangleRoi) rois.get(0);
            assertEquals("ROI_1", importedRect.getName());
            assertEquals(50.0, importedRect.getWidth());
            assertEquals(Roi.DEFAULT_EMISSIVITY, importedRect.getEmissivity());
            SpotRoi importedSpot = (SpotRoi) rois.get(1);
            assertEquals(10.0, importedSpot.getCenterX());
            assertEquals(0.0, importedSpot.getCenterY());
            assertEquals(5.0, importedSpot.getRadius());
            assertEquals(RoiType.POLYGON, rois.get(2).getType());
            assertEquals(4, ((PolygonRoi) rois.get(2)).getVertexCount());
        }

        @Test
        void testImport_SkipsBadRecordsAndAdds() {
            controller.createRectangle(0, 0, 5, 5);
            RoiRecord unknown = new RoiRecord();
            unknown.setType("Ellipse");
            RoiRecord negative = RoiRecord.rectangle("bad", 0.95, 0, 0, -1, 5);
            RoiRecord good = RoiRecord.spot("ok", 0.9, 3, 3, 1);

            assertEquals(1, controller.importRois(Arrays.asList(unknown, null, negative, good)));

            assertEquals(2, controller.size());
            assertEquals("ok", controller.getRois().get(1).getName());
            assertEquals(0, controller.importRois(null));
        }

        @Test
        void testExportDetailed() {
            controller.createRectangle(0, 0, 5, 5, "inside", null);
            controller.createSpot(200, 200, 3, "outside", null);

            List<RoiReport> reports = controller.exportDetailed();

            RoiReport inside = reports.get(0);
            assertEquals("inside", inside.getName());
            assertEquals("Rectangle", inside.getType());
            assertEquals(25, inside.getPixelCount());
            assertEquals(expectedCelsius(Roi.DEFAULT_EMISSIVITY), inside.getTempMedian().doubleValue(), 1e-9);
            RoiReport outside = reports.get(1);
            assertEquals(0, outside.getPixelCount());
            assertNull(outside.getTempMean());
        }
    }
}
