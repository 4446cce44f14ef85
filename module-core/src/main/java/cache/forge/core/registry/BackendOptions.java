package cache.forge.core.registry;

import cache.forge.error.exception.InvalidCacheArgumentException;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * 백엔드 생성 옵션 (문자열 맵 + 타입 변환 getter)
 *
 * <p>키는 대소문자와 {@code -}, {@code _} 구분 없이 비교합니다. {@code max-size}, {@code max_size}, {@code maxSize}는
 * 같은 옵션입니다.
 *
 * <p>Duration 값은 {@code 30s}, {@code 5m}, {@code 2h}, {@code 250ms}, ISO-8601({@code PT30S}) 또는 초 단위 숫자를
 * 받습니다.
 */
public final class BackendOptions {

  private static final BackendOptions EMPTY = new BackendOptions(Map.of());

  private final Map<String, String> values;

  private BackendOptions(Map<String, String> values) {
    this.values = values;
  }

  public static BackendOptions empty() {
    return EMPTY;
  }

  public static BackendOptions of(Map<String, ?> raw) {
    Map<String, String> normalized = new LinkedHashMap<>();
    raw.forEach(
        (key, value) -> {
          if (value != null) {
            normalized.put(normalize(key), String.valueOf(value));
          }
        });
    return new BackendOptions(Collections.unmodifiableMap(normalized));
  }

  public static BackendOptions of(String key, Object value) {
    return of(Map.of(key, value));
  }

  public Optional<String> find(String key) {
    return Optional.ofNullable(values.get(normalize(key)));
  }

  public String getString(String key, String defaultValue) {
    return find(key).orElse(defaultValue);
  }

  public int getInt(String key, int defaultValue) {
    return find(key).map(v -> parseInt(key, v)).orElse(defaultValue);
  }

  public long getLong(String key, long defaultValue) {
    return find(key).map(v -> parseNumber(key, v)).orElse(defaultValue);
  }

  public boolean getBoolean(String key, boolean defaultValue) {
    return find(key).map(v -> parseBoolean(key, v)).orElse(defaultValue);
  }

  public Duration getDuration(String key, Duration defaultValue) {
    return find(key).map(v -> parseDuration(key, v)).orElse(defaultValue);
  }

  public Map<String, String> asMap() {
    return values;
  }

  private static String normalize(String key) {
    return key.replace("-", "").replace("_", "").toLowerCase(Locale.ROOT);
  }

  private static long parseNumber(String key, String value) {
    try {
      return Long.parseLong(value.trim());
    } catch (NumberFormatException e) {
      throw new InvalidCacheArgumentException(key + "=" + value);
    }
  }

  private static int parseInt(String key, String value) {
    long parsed = parseNumber(key, value);
    if (parsed < Integer.MIN_VALUE || parsed > Integer.MAX_VALUE) {
      throw new InvalidCacheArgumentException(key + "=" + value);
    }
    return (int) parsed;
  }

  private static boolean parseBoolean(String key, String value) {
    String v = value.trim().toLowerCase(Locale.ROOT);
    return switch (v) {
      case "true", "yes", "on", "1" -> true;
      case "false", "no", "off", "0" -> false;
      default -> throw new InvalidCacheArgumentException(key + "=" + value);
    };
  }

  static Duration parseDuration(String key, String value) {
    String v = value.trim().toLowerCase(Locale.ROOT);
    try {
      if (v.startsWith("p")) {
        return Duration.parse(v.toUpperCase(Locale.ROOT));
      }
      if (v.endsWith("ms")) {
        return Duration.ofMillis(Long.parseLong(v.substring(0, v.length() - 2).trim()));
      }
      if (v.endsWith("s")) {
        return Duration.ofSeconds(Long.parseLong(v.substring(0, v.length() - 1).trim()));
      }
      if (v.endsWith("m")) {
        return Duration.ofMinutes(Long.parseLong(v.substring(0, v.length() - 1).trim()));
      }
      if (v.endsWith("h")) {
        return Duration.ofHours(Long.parseLong(v.substring(0, v.length() - 1).trim()));
      }
      return Duration.ofSeconds(Long.parseLong(v));
    } catch (NumberFormatException | DateTimeParseException e) {
      throw new InvalidCacheArgumentException(key + "=" + value);
    }
  }

  @Override
  public String toString() {
    return "BackendOptions" + values;
  }
}
