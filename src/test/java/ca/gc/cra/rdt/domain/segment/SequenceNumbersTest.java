package ca.gc.cra.rdt.domain.segment;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class SequenceNumbersTest {

  @Test
  void unwrapPicksPositionNearestReference() {
    assertEquals(10L, SequenceNumbers.unwrap(5L, 10L));
    assertEquals(2L, SequenceNumbers.unwrap(5L, 2L));
  }

  @Test
  void unwrapCrossesTheWrapBoundary() {
    long reference = SequenceNumbers.MODULUS - 3;

    assertEquals(SequenceNumbers.MODULUS + 4, SequenceNumbers.unwrap(reference, 4L));
    assertEquals(SequenceNumbers.MODULUS - 10, SequenceNumbers.unwrap(SequenceNumbers.MODULUS + 2, SequenceNumbers.MODULUS - 10));
  }

  @Test
  void toWireMasksToThirtyTwoBits() {
    assertEquals(0L, SequenceNumbers.toWire(SequenceNumbers.MODULUS));
    assertEquals(SequenceNumbers.MODULUS - 1, SequenceNumbers.toWire(-1L));
  }
}
