package com.vigil.detection.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

public class SeverityTest {

  @ParameterizedTest
  @CsvSource({
      "0.0,LOW", "1.99,LOW", "2.0,MEDIUM", "2.99,MEDIUM",
      "3.0,HIGH", "3.49,HIGH", "3.5,CRITICAL", "12.0,CRITICAL" })
  void boundaries(double score, Severity expected) {
    assertEquals(expected, Severity.fromScore(score));
    assertEquals(expected, Severity.fromScore(-score));
  }

  @Test
  void monotonicInMagnitude() {
    Severity previous = Severity.LOW;
    for (double s = 0; s < 6; s += 0.01) {
      Severity current = Severity.fromScore(s);
      assertTrue(current.rank() >= previous.rank(), "dropped at " + s);
      previous = current;
    }
  }

  @Test
  void rankComparison() {
    assertTrue(Severity.MEDIUM.atLeast(Severity.MEDIUM));
    assertFalse(Severity.LOW.atLeast(Severity.MEDIUM));
    assertTrue(Severity.CRITICAL.atLeast(Severity.HIGH));
  }

  @Test
  void parseLabels() {
    assertEquals(Optional.of(Severity.HIGH), Severity.parse("high"));
    assertEquals(Optional.of(Severity.CRITICAL), Severity.parse(" CRITICAL "));
    assertEquals(Optional.empty(), Severity.parse("severe"));
    assertEquals(Optional.empty(), Severity.parse(null));
    assertEquals("medium", Severity.MEDIUM.label());
  }
}
