package seqrw.rewriter;

/**
 * Tunables of a {@link SeqRewriter}. Defaults come from system properties so that a run can be
 * reconfigured without code changes:
 *
 * <ul>
 *   <li>{@code seqrw.coalesce_chars} (true): merge units of constants into string literals
 *   <li>{@code seqrw.max_cache_size} (10000): op cache entries before a wholesale reset
 *   <li>{@code seqrw.contains_pattern} (false): rewrite memberships in contains-patterns
 *   <li>{@code seqrw.re_ite_rewrite} (false): fold regex-sorted ite into a conditional regex
 * </ul>
 */
public class RewriterConfig {
  public static final String COALESCE_CHARS = "seqrw.coalesce_chars";
  public static final String MAX_CACHE_SIZE = "seqrw.max_cache_size";
  public static final String CONTAINS_PATTERN = "seqrw.contains_pattern";
  public static final String RE_ITE_REWRITE = "seqrw.re_ite_rewrite";

  private boolean coalesceChars;
  private int maxCacheSize;
  private boolean containsPattern;
  private boolean reIteRewrite;

  private RewriterConfig() {}

  public static RewriterConfig fromSystemProperties() {
    final RewriterConfig config = new RewriterConfig();
    config.coalesceChars = Boolean.parseBoolean(System.getProperty(COALESCE_CHARS, "true"));
    config.maxCacheSize = Integer.parseInt(System.getProperty(MAX_CACHE_SIZE, "10000"));
    config.containsPattern = Boolean.parseBoolean(System.getProperty(CONTAINS_PATTERN, "false"));
    config.reIteRewrite = Boolean.parseBoolean(System.getProperty(RE_ITE_REWRITE, "false"));
    if (config.maxCacheSize <= 0)
      throw new IllegalArgumentException(MAX_CACHE_SIZE + " must be positive");
    return config;
  }

  public boolean coalesceChars() {
    return coalesceChars;
  }

  public RewriterConfig setCoalesceChars(boolean coalesceChars) {
    this.coalesceChars = coalesceChars;
    return this;
  }

  public int maxCacheSize() {
    return maxCacheSize;
  }

  public RewriterConfig setMaxCacheSize(int maxCacheSize) {
    if (maxCacheSize <= 0) throw new IllegalArgumentException("cache size must be positive");
    this.maxCacheSize = maxCacheSize;
    return this;
  }

  public boolean containsPattern() {
    return containsPattern;
  }

  public RewriterConfig setContainsPattern(boolean containsPattern) {
    this.containsPattern = containsPattern;
    return this;
  }

  public boolean reIteRewrite() {
    return reIteRewrite;
  }

  public RewriterConfig setReIteRewrite(boolean reIteRewrite) {
    this.reIteRewrite = reIteRewrite;
    return this;
  }

  @Override
  public String toString() {
    return "RewriterConfig{coalesceChars=%b, maxCacheSize=%d, containsPattern=%b, reIteRewrite=%b}"
        .formatted(coalesceChars, maxCacheSize, containsPattern, reIteRewrite);
  }
}
