package cache.forge.core.registry;

import cache.forge.core.backend.CacheBackend;
import cache.forge.error.exception.BackendAlreadyRegisteredException;
import cache.forge.error.exception.BackendNotRegisteredException;
import cache.forge.error.exception.InvalidCacheArgumentException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;

/**
 * 백엔드 이름 → 팩토리 레지스트리
 *
 * <p>전역 싱글턴이 아니라 명시적으로 전달되는 값입니다. 이름은 대소문자를 구분하지 않습니다.
 *
 * <pre>{@code
 * CacheBackendRegistry registry = new CacheBackendRegistry();
 * registry.register("memory", options -> new MemoryCacheBackend<>());
 * CacheBackend<Object> backend = registry.create("MEMORY", BackendOptions.empty());
 * }</pre>
 */
@Slf4j
public class CacheBackendRegistry {

  private final Map<String, CacheBackendFactory> factories = new ConcurrentHashMap<>();

  public void register(String name, CacheBackendFactory factory) {
    register(name, factory, false);
  }

  /**
   * @param override {@code true}면 같은 이름의 기존 팩토리를 교체
   * @throws BackendAlreadyRegisteredException 이미 등록된 이름이고 {@code override}가 아닐 때
   */
  public void register(String name, CacheBackendFactory factory, boolean override) {
    String normalized = normalize(name);
    if (factory == null) {
      throw new InvalidCacheArgumentException("factory must not be null: " + name);
    }
    if (override) {
      CacheBackendFactory previous = factories.put(normalized, factory);
      if (previous != null) {
        log.info("[Registry] '{}' 팩토리 교체", normalized);
      }
      return;
    }
    if (factories.putIfAbsent(normalized, factory) != null) {
      throw new BackendAlreadyRegisteredException(normalized);
    }
    log.debug("[Registry] '{}' 등록", normalized);
  }

  public boolean unregister(String name) {
    return factories.remove(normalize(name)) != null;
  }

  public CacheBackend<Object> create(String name) {
    return create(name, BackendOptions.empty());
  }

  /**
   * @throws BackendNotRegisteredException 등록되지 않은 이름
   */
  public CacheBackend<Object> create(String name, BackendOptions options) {
    String normalized = normalize(name);
    CacheBackendFactory factory = factories.get(normalized);
    if (factory == null) {
      throw new BackendNotRegisteredException(normalized);
    }
    return factory.create(options == null ? BackendOptions.empty() : options);
  }

  public boolean isRegistered(String name) {
    return name != null && !name.isBlank() && factories.containsKey(normalize(name));
  }

  public List<String> registeredNames() {
    List<String> names = new ArrayList<>(factories.keySet());
    names.sort(null);
    return names;
  }

  private static String normalize(String name) {
    if (name == null || name.isBlank()) {
      throw new InvalidCacheArgumentException("backend name must not be blank");
    }
    return name.trim().toLowerCase(Locale.ROOT);
  }
}
