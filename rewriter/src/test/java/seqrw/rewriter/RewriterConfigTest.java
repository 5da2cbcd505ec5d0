package seqrw.rewriter;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@Tag("fast")
public class RewriterConfigTest {
  @AfterEach
  void clearProperties() {
    System.clearProperty(RewriterConfig.COALESCE_CHARS);
    System.clearProperty(RewriterConfig.MAX_CACHE_SIZE);
    System.clearProperty(RewriterConfig.RE_ITE_REWRITE);
  }

  @Test
  void testDefaults() {
    final RewriterConfig config = RewriterConfig.fromSystemProperties();
    assertTrue(config.coalesceChars());
    assertEquals(10000, config.maxCacheSize());
    assertFalse(config.containsPattern());
    assertFalse(config.reIteRewrite());
  }

  @Test
  void testSystemProperties() {
    System.setProperty(RewriterConfig.COALESCE_CHARS, "false");
    System.setProperty(RewriterConfig.MAX_CACHE_SIZE, "42");
    System.setProperty(RewriterConfig.RE_ITE_REWRITE, "true");
    final RewriterConfig config = RewriterConfig.fromSystemProperties();
    assertFalse(config.coalesceChars());
    assertEquals(42, config.maxCacheSize());
    assertTrue(config.reIteRewrite());
  }

  @Test
  void testInvalidCacheSize() {
    System.setProperty(RewriterConfig.MAX_CACHE_SIZE, "0");
    assertThrows(IllegalArgumentException.class, RewriterConfig::fromSystemProperties);
    System.clearProperty(RewriterConfig.MAX_CACHE_SIZE);
    assertThrows(
        IllegalArgumentException.class,
        () -> RewriterConfig.fromSystemProperties().setMaxCacheSize(-1));
  }
}
