package cache.forge.core.backend;

import cache.forge.error.exception.InvalidCacheArgumentException;
import java.util.Collection;
import java.util.Map;

/** 키/값 인자 검증 */
public final class CacheKeys {

  private CacheKeys() {}

  public static String requireValid(String key) {
    if (key == null || key.isEmpty()) {
      throw new InvalidCacheArgumentException("key must not be empty");
    }
    return key;
  }

  public static void requireValid(Collection<String> keys) {
    if (keys == null) {
      throw new InvalidCacheArgumentException("keys must not be null");
    }
    keys.forEach(CacheKeys::requireValid);
  }

  public static <V> V requireValue(V value) {
    if (value == null) {
      throw new InvalidCacheArgumentException("value must not be null");
    }
    return value;
  }

  public static void requireEntries(Map<String, ?> entries) {
    if (entries == null) {
      throw new InvalidCacheArgumentException("entries must not be null");
    }
    entries.forEach(
        (key, value) -> {
          requireValid(key);
          requireValue(value);
        });
  }
}
