package cache.forge.infrastructure.redis;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import cache.forge.codec.JacksonCacheCodec;
import cache.forge.codec.StringCacheCodec;
import cache.forge.core.backend.KeysPage;
import cache.forge.core.lock.DistributedLock;
import cache.forge.error.exception.CacheConnectionException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

/** 실제 Redis 컨테이너 대상 테스트. Docker가 없으면 건너뜁니다. */
@Testcontainers(disabledWithoutDocker = true)
@DisplayName("RedisCacheBackend 통합 테스트")
class RedisCacheBackendIntegrationTest {

  @Container
  private static final GenericContainer<?> REDIS =
      new GenericContainer<>(DockerImageName.parse("redis:7-alpine")).withExposedPorts(6379);

  private RedisCacheBackend<String> cache;

  @BeforeEach
  void setUp() {
    cache = open("it:");
    cache.clear();
  }

  @AfterEach
  void tearDown() {
    cache.close();
  }

  private static String address() {
    return "redis://" + REDIS.getHost() + ":" + REDIS.getMappedPort(6379);
  }

  private static RedisCacheBackend<String> open(String prefix) {
    return RedisCacheBackend.<String>builder()
        .address(address())
        .keyPrefix(prefix)
        .connectionPoolSize(4)
        .codec(StringCacheCodec.INSTANCE)
        .build();
  }

  @Test
  @DisplayName("값과 TTL을 Redis에 저장한다")
  void setGetAndTtl() {
    cache.set("user:1", "alice", Duration.ofSeconds(30));
    cache.set("forever", "v");

    assertThat(cache.get("user:1")).contains("alice");
    assertThat(cache.ttl("user:1")).isBetween(29L, 30L);
    assertThat(cache.ttl("forever")).isEqualTo(-1L);
    assertThat(cache.ttl("missing")).isEqualTo(-2L);
  }

  @Test
  @DisplayName("짧은 TTL은 Redis가 만료시킨다")
  void expiresOnServer() throws InterruptedException {
    cache.set("short", "v", Duration.ofMillis(100));

    Thread.sleep(300);

    assertThat(cache.get("short")).isEmpty();
  }

  @Test
  @DisplayName("NX 쓰기는 한 번만 성공한다")
  void nxOnlyOnce() {
    assertThat(cache.set("nx", "first", Duration.ofSeconds(10), true)).isTrue();
    assertThat(cache.set("nx", "second", Duration.ofSeconds(10), true)).isFalse();
    assertThat(cache.get("nx")).contains("first");
  }

  @Test
  @DisplayName("배치 연산은 파이프라인과 MGET, 다중 DEL로 동작한다")
  void batchOperations() {
    Map<String, String> entries = new LinkedHashMap<>();
    entries.put("a", "1");
    entries.put("b", "2");
    cache.setMany(entries, Duration.ofMinutes(1));

    assertThat(cache.getMany(List.of("a", "x", "b")))
        .containsExactly(Map.entry("a", "1"), Map.entry("b", "2"));
    assertThat(cache.deleteMany(List.of("a", "b", "x"))).isEqualTo(2);
  }

  @Test
  @DisplayName("작은 페이지로 끝까지 넘기면 모든 키를 본다")
  void scanVisitsEveryKey() {
    Set<String> expected = new HashSet<>();
    for (int i = 0; i < 250; i++) {
      cache.set("item:" + i, "v");
      expected.add("item:" + i);
    }
    cache.set("other", "v");

    List<String> visited = new ArrayList<>();
    long cursor = 0L;
    do {
      KeysPage page = cache.keys("item:*", cursor, 7, null);
      assertThat(page.keys()).hasSizeLessThanOrEqualTo(7);
      visited.addAll(page.keys());
      cursor = page.cursor();
    } while (cursor != 0L);

    assertThat(new HashSet<>(visited)).isEqualTo(expected);
  }

  @Test
  @DisplayName("clear는 다른 prefix의 키를 건드리지 않는다")
  void clearIsScopedToPrefix() {
    try (RedisCacheBackend<String> other = open("other:")) {
      other.set("keep", "v");
      cache.set("drop", "v");

      cache.clear();

      assertThat(cache.size()).isZero();
      assertThat(other.get("keep")).contains("v");
      other.clear();
    }
  }

  @Test
  @DisplayName("Async 연산은 RFuture 위에서 동작한다")
  void asyncOperations() {
    assertThat(cache.setAsync("async", "v", Duration.ofSeconds(5)).join()).isTrue();
    assertThat(cache.getAsync("async").join()).contains("v");
    assertThat(cache.ttlAsync("async").join()).isBetween(1L, 5L);
    assertThat(cache.deleteAsync("async").join()).isTrue();
    assertThat(cache.existsAsync("async").join()).isFalse();
  }

  @Test
  @DisplayName("카운터와 헬스 체크")
  void countersAndHealth() {
    assertThat(cache.increment("hits", 3)).isEqualTo(3);
    assertThat(cache.decrement("hits", 1)).isEqualTo(2);
    assertThat(cache.checkHealth()).isTrue();
  }

  @Test
  @DisplayName("분산 락은 Redis 위에서 한 소유자만 허용한다")
  void distributedLockOverRedis() {
    DistributedLock first =
        DistributedLock.builder().backend(cache).name("job").timeout(Duration.ofSeconds(5)).build();
    DistributedLock second =
        DistributedLock.builder()
            .backend(cache)
            .name("job")
            .blocking(false)
            .timeout(Duration.ofSeconds(5))
            .build();

    assertThat(first.acquire()).isTrue();
    assertThat(second.acquire()).isFalse();
    second.release();
    assertThat(first.isLocked()).isTrue();

    first.release();
    assertThat(second.acquire()).isTrue();
    second.release();
  }

  @Test
  @DisplayName("JSON 코덱으로 객체를 저장한다")
  void jsonCodec() {
    try (RedisCacheBackend<Profile> profiles =
        RedisCacheBackend.<Profile>builder()
            .address(address())
            .keyPrefix("it:profile:")
            .connectionPoolSize(2)
            .codec(JacksonCacheCodec.of(Profile.class))
            .build()) {
      profiles.set("1", new Profile("alice", 30));

      assertThat(profiles.get("1")).contains(new Profile("alice", 30));
      profiles.clear();
    }
  }

  @Test
  @DisplayName("도달할 수 없는 서버는 생성 시점에 CacheConnectionException")
  void unreachableServer() {
    assertThatThrownBy(
            () ->
                RedisCacheBackend.<String>builder()
                    .address("redis://127.0.0.1:1")
                    .connectTimeout(Duration.ofMillis(300))
                    .timeout(Duration.ofMillis(300))
                    .connectionPoolSize(1)
                    .codec(StringCacheCodec.INSTANCE)
                    .build())
        .isInstanceOf(CacheConnectionException.class);
  }

  record Profile(String name, int age) {}
}
