package io.arrowsource.formats.config;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.Test;

/** Tests for BufferingOptions and its string map form. */
public class BufferingOptionsTest {

  @Test
  void testDefaults() {
    BufferingOptions options = BufferingOptions.defaults();
    assertEquals(512, options.batchSize());
    assertEquals(Duration.ofMillis(100), options.batchLinger());
  }

  @Test
  void testFromStringMap() {
    BufferingOptions options =
        BufferingOptions.fromStringMap(
            Map.of("source.batch_size", "1024", "source.batch_linger_ms", " 250 ", "other", "x"));
    assertEquals(1024, options.batchSize());
    assertEquals(Duration.ofMillis(250), options.batchLinger());
  }

  @Test
  void testToOptionsMapRoundTrips() {
    BufferingOptions options =
        BufferingOptions.builder().batchSize(8).batchLinger(Duration.ofSeconds(2)).build();
    Map<String, String> map = options.toOptionsMap();
    assertEquals("8", map.get("source.batch_size"));
    assertEquals("2000", map.get("source.batch_linger_ms"));
    assertEquals(options, BufferingOptions.fromStringMap(map));
  }

  @Test
  void testInvalidValuesAreRejected() {
    IllegalArgumentException e =
        assertThrows(
            IllegalArgumentException.class,
            () -> BufferingOptions.fromStringMap(Map.of("source.batch_size", "many")));
    assertTrue(e.getMessage().contains("source.batch_size"));
    assertThrows(
        IllegalArgumentException.class, () -> BufferingOptions.builder().batchSize(0).build());
    assertThrows(
        IllegalArgumentException.class,
        () -> BufferingOptions.builder().batchLinger(Duration.ofMillis(-1)).build());
  }
}
