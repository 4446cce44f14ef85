package cache.forge.infrastructure.config;

import cache.forge.codec.JdkSerializationCodec;
import cache.forge.core.backend.CacheBackend;
import cache.forge.core.backend.memory.MemoryCacheBackend;
import cache.forge.core.registry.BackendOptions;
import cache.forge.core.registry.CacheBackendRegistry;
import cache.forge.infrastructure.executor.LogicExecutor;
import cache.forge.infrastructure.redis.RedisCacheBackend;
import cache.forge.infrastructure.sqlite.SqliteCacheBackend;
import java.nio.file.Path;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RedissonClient;

/**
 * 내장 백엔드({@code memory}, {@code file}, {@code redis}) 등록
 *
 * <p>각 팩토리는 {@link CacheForgeProperties} 값을 기본으로 쓰고 {@link BackendOptions}에 같은 이름의 옵션이 있으면 그 값을
 * 우선합니다. 값은 {@link JdkSerializationCodec}으로 저장합니다.
 *
 * <pre>{@code
 * CacheBackend<Object> cache =
 *     registry.create("file", BackendOptions.of(Map.of("path", "/tmp/app.db", "max-size", 500)));
 * }</pre>
 */
@Slf4j
public final class BuiltInBackends {

  public static final String MEMORY = "memory";
  public static final String FILE = "file";
  public static final String REDIS = "redis";

  private BuiltInBackends() {}

  public static void registerAll(
      CacheBackendRegistry registry, LogicExecutor executor, CacheForgeProperties defaults) {
    registerAll(registry, executor, defaults, null);
  }

  /**
   * @param sharedClient 있으면 {@code redis} 백엔드가 이 클라이언트를 빌려 씀 (주소 옵션 무시)
   */
  public static void registerAll(
      CacheBackendRegistry registry,
      LogicExecutor executor,
      CacheForgeProperties defaults,
      RedissonClient sharedClient) {
    registry.register(MEMORY, options -> memory(options, defaults.memory()));
    registry.register(FILE, options -> file(options, defaults.file(), executor));
    registry.register(REDIS, options -> redis(options, defaults.redis(), executor, sharedClient));
    log.info("[Registry] 내장 백엔드 등록 완료: {}", registry.registeredNames());
  }

  static CacheBackend<Object> memory(BackendOptions options, CacheForgeProperties.Memory defaults) {
    return MemoryCacheBackend.<Object>builder()
        .maxSize(options.getInt("maxSize", defaults.maxSize()))
        .cleanupInterval(options.getDuration("cleanupInterval", defaults.cleanupInterval()))
        .build();
  }

  static CacheBackend<Object> file(
      BackendOptions options, CacheForgeProperties.File defaults, LogicExecutor executor) {
    return SqliteCacheBackend.<Object>builder()
        .path(Path.of(options.getString("path", defaults.path())))
        .maxSize(options.getInt("maxSize", defaults.maxSize()))
        .cleanupInterval(options.getDuration("cleanupInterval", defaults.cleanupInterval()))
        .hotReload(options.getBoolean("hotReload", defaults.hotReload()))
        .poolSize(options.getInt("poolSize", defaults.poolSize()))
        .busyTimeout(options.getDuration("busyTimeout", defaults.busyTimeout()))
        .codec(new JdkSerializationCodec<>())
        .executor(executor)
        .build();
  }

  static CacheBackend<Object> redis(
      BackendOptions options,
      CacheForgeProperties.Redis defaults,
      LogicExecutor executor,
      RedissonClient sharedClient) {
    return RedisCacheBackend.<Object>builder()
        .client(sharedClient)
        .address(options.getString("address", defaults.address()))
        .password(options.getString("password", defaults.password()))
        .database(options.getInt("database", defaults.database()))
        .keyPrefix(options.getString("keyPrefix", defaults.keyPrefix()))
        .timeout(options.getDuration("timeout", defaults.timeout()))
        .connectTimeout(options.getDuration("connectTimeout", defaults.connectTimeout()))
        .connectionPoolSize(options.getInt("connectionPoolSize", defaults.connectionPoolSize()))
        .codec(new JdkSerializationCodec<>())
        .executor(executor)
        .build();
  }
}
