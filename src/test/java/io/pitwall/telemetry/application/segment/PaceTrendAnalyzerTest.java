package io.pitwall.telemetry.application.segment;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.pitwall.telemetry.domain.confidence.ConfidenceValue;
import io.pitwall.telemetry.domain.confidence.DataSource;
import io.pitwall.telemetry.domain.confidence.SegmentQuality;
import io.pitwall.telemetry.domain.pace.DegradationType;
import io.pitwall.telemetry.domain.pace.PaceTrend;
import io.pitwall.telemetry.domain.pace.SegmentSpeedResult;
import io.pitwall.telemetry.domain.track.SegmentType;
import java.util.List;
import org.junit.jupiter.api.Test;

class PaceTrendAnalyzerTest {
  private static final long NOW = 5_000L;

  private final PaceTrendAnalyzer analyzer = new PaceTrendAnalyzer(DetectorSettings.defaults());

  @Test
  void tooFewCleanSamplesYieldsNothing() {
    List<SegmentSpeedResult> history = List.of(
        clean(1, 20_000L, SegmentType.STRAIGHT),
        clean(2, 20_000L, SegmentType.STRAIGHT),
        result(3, 20_000L, SegmentType.STRAIGHT, SegmentQuality.TRAFFIC_AFFECTED));

    assertTrue(analyzer.analyze("s", "car", history, NOW).isEmpty());
  }

  @Test
  void risingSegmentTimesInferTireDegradation() {
    PaceTrend trend = analyzer.analyze("s", "car", List.of(
        clean(1, 20_000L, SegmentType.STRAIGHT),
        clean(2, 20_100L, SegmentType.STRAIGHT),
        clean(3, 20_200L, SegmentType.STRAIGHT)), NOW).orElseThrow();

    assertEquals(100d, trend.paceSlope().value().getAsDouble(), 1e-9);
    assertEquals(1d, trend.paceSlope().confidence(), 1e-9);
    assertEquals(DataSource.INFERRED, trend.paceSlope().source());
    assertEquals(DegradationType.TIRE, trend.degradationType());
  }

  @Test
  void fallingSegmentTimesBeyondThresholdInferFuelBurn() {
    PaceTrend trend = analyzer.analyze("s", "car", List.of(
        clean(1, 20_200L, SegmentType.CORNER),
        clean(2, 20_180L, SegmentType.CORNER),
        clean(3, 20_160L, SegmentType.CORNER)), NOW).orElseThrow();

    assertEquals(-20d, trend.paceSlope().value().getAsDouble(), 1e-9);
    assertEquals(DegradationType.FUEL_BURN, trend.degradationType());
  }

  @Test
  void smallNegativeSlopeStaysUnknown() {
    PaceTrend trend = analyzer.analyze("s", "car", List.of(
        clean(1, 20_010L, SegmentType.CORNER),
        clean(2, 20_005L, SegmentType.CORNER),
        clean(3, 20_000L, SegmentType.CORNER)), NOW).orElseThrow();

    assertEquals(DegradationType.UNKNOWN, trend.degradationType());
  }

  @Test
  void samplesFromOneLapLeaveSlopeUndefined() {
    PaceTrend trend = analyzer.analyze("s", "car", List.of(
        clean(4, 20_000L, SegmentType.STRAIGHT),
        clean(4, 21_000L, SegmentType.CORNER),
        clean(4, 22_000L, SegmentType.STRAIGHT)), NOW).orElseThrow();

    assertFalse(trend.paceSlope().isDefined());
    assertEquals(0d, trend.paceSlope().confidence());
    assertEquals(DegradationType.UNKNOWN, trend.degradationType());
  }

  @Test
  void constantSegmentTimesFitPerfectly() {
    PaceTrend trend = analyzer.analyze("s", "car", List.of(
        clean(1, 20_000L, SegmentType.STRAIGHT),
        clean(2, 20_000L, SegmentType.STRAIGHT),
        clean(3, 20_000L, SegmentType.STRAIGHT)), NOW).orElseThrow();

    assertEquals(0d, trend.paceSlope().value().getAsDouble(), 1e-9);
    assertEquals(1d, trend.paceSlope().confidence(), 1e-9);
    assertEquals(DegradationType.UNKNOWN, trend.degradationType());
  }

  @Test
  void splitsStraightAndCornerPace() {
    PaceTrend trend = analyzer.analyze("s", "car", List.of(
        clean(1, 10_000L, SegmentType.STRAIGHT),
        clean(1, 20_000L, SegmentType.CORNER),
        clean(2, 10_000L, SegmentType.START_FINISH),
        clean(2, 40_000L, SegmentType.COMPLEX)), NOW).orElseThrow();

    assertEquals(100d, trend.straightPace().value().getAsDouble(), 1e-9);
    assertEquals(37.5d, trend.cornerPace().value().getAsDouble(), 1e-9);
    assertEquals(68.75d, trend.overallPace().value().getAsDouble(), 1e-9);
    assertEquals(0.4d, trend.overallPace().confidence(), 1e-9);
    assertEquals(0.2d, trend.straightPace().confidence(), 1e-9);
  }

  @Test
  void missingCornerSamplesLeaveCornerPaceUndefined() {
    PaceTrend trend = analyzer.analyze("s", "car", List.of(
        clean(1, 20_000L, SegmentType.STRAIGHT),
        clean(2, 20_000L, SegmentType.STRAIGHT),
        clean(3, 20_000L, SegmentType.PIT_EXIT)), NOW).orElseThrow();

    assertFalse(trend.cornerPace().isDefined());
    assertEquals(SegmentQuality.UNKNOWN, trend.cornerPace().quality());
    assertTrue(trend.overallPace().isDefined());
  }

  @Test
  void summaryDropsToTrafficAffectedWhenCleanShareIsLow() {
    List<SegmentSpeedResult> history = List.of(
        clean(1, 20_000L, SegmentType.STRAIGHT),
        clean(2, 20_000L, SegmentType.STRAIGHT),
        clean(3, 20_000L, SegmentType.STRAIGHT),
        result(3, 20_000L, SegmentType.CORNER, SegmentQuality.TRAFFIC_AFFECTED),
        result(3, 20_000L, SegmentType.CORNER, SegmentQuality.PIT));

    PaceTrend trend = analyzer.analyze("s", "car", history, NOW).orElseThrow();

    assertEquals(3, trend.cleanSampleCount());
    assertEquals(5, trend.totalSampleCount());
    assertEquals(SegmentQuality.TRAFFIC_AFFECTED, trend.dataQualitySummary());
  }

  @Test
  void summaryIsCleanWhenAllSamplesAreClean() {
    PaceTrend trend = analyzer.analyze("s", "car", List.of(
        clean(1, 20_000L, SegmentType.STRAIGHT),
        clean(2, 20_000L, SegmentType.STRAIGHT),
        clean(3, 20_000L, SegmentType.STRAIGHT)), NOW).orElseThrow();

    assertEquals(SegmentQuality.CLEAN, trend.dataQualitySummary());
    assertEquals(NOW, trend.timestampMillis());
  }

  private static SegmentSpeedResult clean(int lap, long timeMs, SegmentType type) {
    return result(lap, timeMs, type, SegmentQuality.CLEAN);
  }

  private static SegmentSpeedResult result(int lap, long timeMs, SegmentType type, SegmentQuality quality) {
    ConfidenceValue speed = ConfidenceValue.of(1_000d / (timeMs / 1_000d), 0.9d, DataSource.DERIVED, quality, 0L);
    return new SegmentSpeedResult("car", "seg", type, timeMs, 0L, timeMs, speed, quality, List.of(), lap);
  }
}
