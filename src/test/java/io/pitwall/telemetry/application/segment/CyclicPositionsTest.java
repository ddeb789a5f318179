package io.pitwall.telemetry.application.segment;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class CyclicPositionsTest {

  @Test
  void deltaAcrossStartFinishIsShortForward() {
    assertEquals(0.1d, CyclicPositions.wrapSafeDelta(0.95, 0.05), 1e-9);
  }

  @Test
  void deltaBackwardAcrossStartFinishIsShortNegative() {
    assertEquals(-0.1d, CyclicPositions.wrapSafeDelta(0.05, 0.95), 1e-9);
  }

  @Test
  void plainDeltaIsUnchanged() {
    assertEquals(0.2d, CyclicPositions.wrapSafeDelta(0.3, 0.5), 1e-9);
    assertEquals(-0.2d, CyclicPositions.wrapSafeDelta(0.5, 0.3), 1e-9);
  }

  @Test
  void deltaConvertsToMeters() {
    assertEquals(250d, CyclicPositions.deltaToMeters(0.05, 5_000d), 1e-9);
  }

  @Test
  void normalizeFoldsIntoUnitInterval() {
    assertEquals(0.25d, CyclicPositions.normalize(1.25), 1e-9);
    assertEquals(0.75d, CyclicPositions.normalize(-0.25), 1e-9);
    assertEquals(0d, CyclicPositions.normalize(1d), 1e-9);
  }
}
