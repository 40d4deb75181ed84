package io.intellixity.cursorpaging.paging;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;
import java.util.concurrent.Executor;

/**
 * Engine-wide pagination defaults.\n
 *
 * Loaded from a Java Properties resource ({@value #RESOURCE}) of the form:
 *
 * <pre>
 * cursorpaging.default-limit=25
 * cursorpaging.max-limit=1000
 * cursorpaging.count-total=true
 * cursorpaging.tie-breaker-field=_id
 * </pre>
 *
 * @param defaultLimit page size used by request builders that do not set one
 * @param maxLimit largest page size a paginator accepts
 * @param countTotal whether request builders ask for the total count by default
 * @param tieBreakerField unique field appended to every sort, or null to leave sorts untouched
 * @param countExecutor runs the count concurrently with the find; null runs both on the caller thread
 */
public record PagingSettings(int defaultLimit,
                             int maxLimit,
                             boolean countTotal,
                             String tieBreakerField,
                             Executor countExecutor) {
  public static final String RESOURCE = "cursorpaging.properties";
  public static final int DEFAULT_LIMIT = 25;
  public static final int DEFAULT_MAX_LIMIT = 1000;

  static final String KEY_DEFAULT_LIMIT = "cursorpaging.default-limit";
  static final String KEY_MAX_LIMIT = "cursorpaging.max-limit";
  static final String KEY_COUNT_TOTAL = "cursorpaging.count-total";
  static final String KEY_TIE_BREAKER = "cursorpaging.tie-breaker-field";

  public PagingSettings {
    if (defaultLimit <= 0) throw new IllegalArgumentException("defaultLimit must be > 0");
    if (maxLimit < defaultLimit) throw new IllegalArgumentException("maxLimit must be >= defaultLimit");
    tieBreakerField = (tieBreakerField == null || tieBreakerField.isBlank()) ? null : tieBreakerField.trim();
  }

  public static PagingSettings defaults() {
    return new PagingSettings(DEFAULT_LIMIT, DEFAULT_MAX_LIMIT, true, null, null);
  }

  public PagingSettings withDefaultLimit(int v) { return new PagingSettings(v, Math.max(v, maxLimit), countTotal, tieBreakerField, countExecutor); }
  public PagingSettings withMaxLimit(int v) { return new PagingSettings(defaultLimit, v, countTotal, tieBreakerField, countExecutor); }
  public PagingSettings withCountTotal(boolean v) { return new PagingSettings(defaultLimit, maxLimit, v, tieBreakerField, countExecutor); }
  public PagingSettings withTieBreakerField(String v) { return new PagingSettings(defaultLimit, maxLimit, countTotal, v, countExecutor); }
  public PagingSettings withCountExecutor(Executor v) { return new PagingSettings(defaultLimit, maxLimit, countTotal, tieBreakerField, v); }

  /** Reads {@value #RESOURCE} from the context class loader; defaults when absent. */
  public static PagingSettings load() {
    ClassLoader cl = Thread.currentThread().getContextClassLoader();
    if (cl == null) cl = PagingSettings.class.getClassLoader();
    return load(cl, RESOURCE);
  }

  public static PagingSettings load(ClassLoader cl, String resource) {
    Properties p = new Properties();
    try (InputStream in = cl.getResourceAsStream(resource)) {
      if (in == null) return defaults();
      p.load(in);
    } catch (IOException e) {
      throw new RuntimeException("Failed to load " + resource, e);
    }
    return fromProperties(p);
  }

  public static PagingSettings fromProperties(Properties p) {
    int defaultLimit = intProp(p, KEY_DEFAULT_LIMIT, DEFAULT_LIMIT);
    int maxLimit = intProp(p, KEY_MAX_LIMIT, Math.max(DEFAULT_MAX_LIMIT, defaultLimit));
    String countTotal = p.getProperty(KEY_COUNT_TOTAL);
    boolean count = (countTotal == null || countTotal.isBlank()) || Boolean.parseBoolean(countTotal.trim());
    return new PagingSettings(defaultLimit, maxLimit, count, p.getProperty(KEY_TIE_BREAKER), null);
  }

  private static int intProp(Properties p, String key, int def) {
    String v = p.getProperty(key);
    if (v == null || v.isBlank()) return def;
    try {
      return Integer.parseInt(v.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid integer for " + key + ": " + v, e);
    }
  }
}
