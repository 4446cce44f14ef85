package cache.forge.infrastructure.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * 내장 백엔드 기본 설정
 *
 * <h2>설정</h2>
 *
 * <pre>{@code
 * cache-forge:
 *   memory:
 *     max-size: 10000
 *     cleanup-interval: 60s
 *   file:
 *     path: ./cache-forge.db
 *     hot-reload: false
 *   redis:
 *     address: redis://localhost:6379
 *     key-prefix: "cacheforge:"
 *   registry:
 *     enabled: true
 * }</pre>
 *
 * <p>여기 값은 {@code registry.create(name, options)}에서 옵션으로 다시 덮어쓸 수 있습니다.
 *
 * @see BuiltInBackends
 */
@ConfigurationProperties(prefix = "cache-forge")
public record CacheForgeProperties(
    @DefaultValue Memory memory,
    @DefaultValue File file,
    @DefaultValue Redis redis,
    @DefaultValue Registry registry) {

  public static CacheForgeProperties defaults() {
    return new CacheForgeProperties(
        new Memory(10_000, Duration.ofSeconds(60)),
        new File(
            "./cache-forge.db", 10_000, Duration.ofSeconds(300), false, 4, Duration.ofSeconds(5)),
        new Redis(
            "redis://localhost:6379",
            null,
            0,
            "cacheforge:",
            Duration.ofSeconds(5),
            Duration.ofSeconds(5),
            50),
        new Registry(true));
  }

  public record Memory(
      @DefaultValue("10000") int maxSize, @DefaultValue("60s") Duration cleanupInterval) {

    public Memory {
      if (maxSize < 0) {
        throw new IllegalArgumentException(
            "cache-forge.memory.max-size must be >= 0, got: " + maxSize);
      }
    }
  }

  public record File(
      @DefaultValue("./cache-forge.db") String path,
      @DefaultValue("10000") int maxSize,
      @DefaultValue("300s") Duration cleanupInterval,
      @DefaultValue("false") boolean hotReload,
      @DefaultValue("4") int poolSize,
      @DefaultValue("5s") Duration busyTimeout) {

    public File {
      if (poolSize <= 0) {
        throw new IllegalArgumentException(
            "cache-forge.file.pool-size must be positive, got: " + poolSize);
      }
    }
  }

  public record Redis(
      @DefaultValue("redis://localhost:6379") String address,
      String password,
      @DefaultValue("0") int database,
      @DefaultValue("cacheforge:") String keyPrefix,
      @DefaultValue("5s") Duration timeout,
      @DefaultValue("5s") Duration connectTimeout,
      @DefaultValue("50") int connectionPoolSize) {}

  public record Registry(@DefaultValue("true") boolean enabled) {}
}
