package cache.forge.infrastructure.sqlite;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import cache.forge.codec.StringCacheCodec;
import cache.forge.core.backend.CacheBackend;
import cache.forge.core.backend.KeysPage;
import cache.forge.error.exception.CacheSerializationException;
import cache.forge.error.exception.InvalidCacheArgumentException;
import cache.forge.infrastructure.executor.DefaultLogicExecutor;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.Statement;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("SqliteCacheBackend 테스트")
class SqliteCacheBackendTest {

  @TempDir Path tempDir;

  private MutableClock clock;
  private Path dbPath;
  private SqliteCacheBackend<String> cache;

  @BeforeEach
  void setUp() {
    clock = MutableClock.startingAt("2024-01-01T00:00:00Z");
    dbPath = tempDir.resolve("nested").resolve("cache.db");
    cache = open(100, false);
  }

  @AfterEach
  void tearDown() {
    cache.close();
  }

  private SqliteCacheBackend<String> open(int maxSize, boolean hotReload) {
    return SqliteCacheBackend.<String>builder()
        .path(dbPath)
        .maxSize(maxSize)
        .codec(StringCacheCodec.INSTANCE)
        .cleanupInterval(Duration.ZERO)
        .hotReload(hotReload)
        .poolSize(2)
        .clock(clock)
        .executor(new DefaultLogicExecutor(new SimpleMeterRegistry()))
        .build();
  }

  private void reopen(int maxSize) {
    cache.close();
    cache = open(maxSize, false);
  }

  private Connection rawConnection() throws Exception {
    return DriverManager.getConnection("jdbc:sqlite:" + dbPath.toAbsolutePath());
  }

  @Nested
  @DisplayName("스키마")
  class Schema {

    @Test
    @DisplayName("상위 디렉터리를 만들고 WAL 모드로 연다")
    void walModeAndParentDirectory() throws Exception {
      assertThat(Files.exists(dbPath)).isTrue();

      try (Connection connection = rawConnection();
          Statement statement = connection.createStatement();
          ResultSet rs = statement.executeQuery("PRAGMA journal_mode")) {
        rs.next();
        assertThat(rs.getString(1)).isEqualToIgnoringCase("wal");
      }
    }

    @Test
    @DisplayName("cache_entries 테이블은 정해진 컬럼을 가진다")
    void tableColumns() throws Exception {
      List<String> columns = new ArrayList<>();
      try (Connection connection = rawConnection();
          Statement statement = connection.createStatement();
          ResultSet rs = statement.executeQuery("PRAGMA table_info(cache_entries)")) {
        while (rs.next()) {
          columns.add(rs.getString("name"));
        }
      }

      assertThat(columns)
          .containsExactly("key", "value", "expires_at", "last_access", "created_at");
    }
  }

  @Nested
  @DisplayName("TTL")
  class Ttl {

    @Test
    @DisplayName("TTL이 지나면 조회되지 않는다")
    void expiresAfterTtl() {
      cache.set("k", "v", Duration.ofSeconds(2));

      clock.advance(Duration.ofMillis(1_999));
      assertThat(cache.get("k")).contains("v");

      clock.advance(Duration.ofMillis(1));
      assertThat(cache.get("k")).isEmpty();
      assertThat(cache.exists("k")).isFalse();
    }

    @Test
    @DisplayName("ttl()은 남은 시간을 초 단위로 올림하고 센티널 값을 지킨다")
    void ttlSentinels() {
      cache.set("forever", "v");
      cache.set("short", "v", Duration.ofSeconds(10));
      clock.advance(Duration.ofMillis(500));

      assertThat(cache.ttl("forever")).isEqualTo(CacheBackend.TTL_NO_EXPIRY);
      assertThat(cache.ttl("short")).isEqualTo(10L);
      assertThat(cache.ttl("missing")).isEqualTo(CacheBackend.TTL_ABSENT);

      clock.advance(Duration.ofSeconds(10));
      assertThat(cache.ttl("short")).isEqualTo(CacheBackend.TTL_ABSENT);
    }

    @Test
    @DisplayName("Instant 범위를 넘는 TTL도 저장되고 먼 미래 만료로 보고된다")
    void hugeTtlSaturates() {
      // given
      boolean written = cache.set("k", "v", Duration.ofSeconds(Long.MAX_VALUE));

      // when
      clock.advance(Duration.ofDays(365));

      // then
      assertThat(written).isTrue();
      assertThat(cache.get("k")).contains("v");
      assertThat(cache.ttl("k")).isGreaterThan(Duration.ofDays(365L * 1_000_000L).getSeconds());
    }

    @Test
    @DisplayName("만료 행은 size에 남아 있다가 sweep으로 삭제된다")
    void sweepRemovesExpiredRows() {
      cache.set("a", "1", Duration.ofSeconds(1));
      cache.set("b", "2", Duration.ofSeconds(1));
      cache.set("c", "3");
      clock.advance(Duration.ofSeconds(5));

      assertThat(cache.size()).isEqualTo(3);
      assertThat(cache.sweepExpired()).isEqualTo(2);
      assertThat(cache.size()).isEqualTo(1);
    }
  }

  @Nested
  @DisplayName("영속성")
  class Persistence {

    @Test
    @DisplayName("닫았다가 다시 열어도 항목과 만료 시각이 유지된다")
    void survivesReopen() {
      cache.set("user:1", "alice");
      cache.set("session", "s", Duration.ofSeconds(30));

      reopen(100);

      assertThat(cache.get("user:1")).contains("alice");
      assertThat(cache.ttl("session")).isEqualTo(30L);
    }
  }

  @Nested
  @DisplayName("LRU 제거")
  class Eviction {

    @Test
    @DisplayName("용량을 넘으면 가장 오래 접근하지 않은 항목을 제거한다")
    void evictsLeastRecentlyUsed() {
      reopen(3);
      cache.set("a", "1");
      cache.set("b", "2");
      cache.set("c", "3");
      cache.get("a");

      cache.set("d", "4");

      assertThat(cache.exists("b")).isFalse();
      assertThat(cache.getMany(List.of("a", "c", "d"))).hasSize(3);
      assertThat(cache.size()).isEqualTo(3);
    }

    @Test
    @DisplayName("기존 키 갱신은 제거를 일으키지 않는다")
    void updateDoesNotEvict() {
      reopen(2);
      cache.set("a", "1");
      cache.set("b", "2");

      cache.set("a", "updated");

      assertThat(cache.get("a")).contains("updated");
      assertThat(cache.get("b")).contains("2");
    }

    @Test
    @DisplayName("용량 0이면 모든 쓰기가 실패한다")
    void zeroCapacityRejectsWrites() {
      reopen(0);

      assertThat(cache.set("a", "1")).isFalse();
      assertThat(cache.size()).isZero();
    }
  }

  @Nested
  @DisplayName("NX")
  class Nx {

    @Test
    @DisplayName("살아 있는 키가 있으면 쓰지 않는다")
    void nxRejectsLiveKey() {
      cache.set("lock", "owner-1", Duration.ofSeconds(10));

      boolean written = cache.set("lock", "owner-2", Duration.ofSeconds(10), true);

      assertThat(written).isFalse();
      assertThat(cache.get("lock")).contains("owner-1");
    }

    @Test
    @DisplayName("만료된 키는 없는 것으로 보고 쓴다")
    void nxOverwritesExpiredKey() {
      cache.set("lock", "owner-1", Duration.ofSeconds(1));
      clock.advance(Duration.ofSeconds(2));

      boolean written = cache.set("lock", "owner-2", Duration.ofSeconds(10), true);

      assertThat(written).isTrue();
      assertThat(cache.get("lock")).contains("owner-2");
    }

    @Test
    @DisplayName("동시 NX set은 정확히 하나만 성공한다")
    void concurrentNxSingleWinner() throws Exception {
      // given
      int threads = 8;
      ExecutorService pool = Executors.newFixedThreadPool(threads);
      CountDownLatch start = new CountDownLatch(1);
      List<Future<Boolean>> results = new ArrayList<>();
      for (int i = 0; i < threads; i++) {
        String owner = "owner-" + i;
        results.add(
            pool.submit(
                () -> {
                  start.await();
                  return cache.set("lock", owner, Duration.ofSeconds(30), true);
                }));
      }

      // when
      start.countDown();
      int winners = 0;
      for (Future<Boolean> result : results) {
        if (result.get(10, TimeUnit.SECONDS)) {
          winners++;
        }
      }
      pool.shutdown();

      // then
      assertThat(winners).isEqualTo(1);
      assertThat(cache.get("lock").orElseThrow()).startsWith("owner-");
      assertThat(cache.ttl("lock")).isEqualTo(30L);
    }
  }

  @Nested
  @DisplayName("배치")
  class Batch {

    @Test
    @DisplayName("setMany는 한 트랜잭션으로 모든 값을 같은 TTL로 쓴다")
    void setManyAppliesSharedTtl() {
      // given
      Map<String, String> entries = new LinkedHashMap<>();
      entries.put("a", "1");
      entries.put("b", "2");
      cache.set("b", "old");

      // when
      cache.setMany(entries, Duration.ofSeconds(5));

      // then
      assertThat(cache.getMany(List.of("a", "b")))
          .containsExactly(Map.entry("a", "1"), Map.entry("b", "2"));
      assertThat(cache.ttl("a")).isEqualTo(5L);
      assertThat(cache.ttl("b")).isEqualTo(5L);

      clock.advance(Duration.ofSeconds(5));
      assertThat(cache.getMany(List.of("a", "b"))).isEmpty();
    }

    @Test
    @DisplayName("getMany는 없는 키와 만료된 키를 결과에서 뺀다")
    void getManyOmitsMisses() {
      Map<String, String> entries = new LinkedHashMap<>();
      entries.put("a", "1");
      entries.put("b", "2");
      cache.setMany(entries, null);
      cache.set("expired", "x", Duration.ofSeconds(1));
      clock.advance(Duration.ofSeconds(1));

      Map<String, String> found = cache.getMany(List.of("a", "missing", "b", "expired"));

      assertThat(found).containsExactly(Map.entry("a", "1"), Map.entry("b", "2"));
    }

    @Test
    @DisplayName("deleteMany는 실제로 지운 live 키 수를 반환한다")
    void deleteManyCountsLiveKeys() {
      cache.set("a", "1");
      cache.set("b", "2");

      int removed = cache.deleteMany(List.of("a", "b", "c"));

      assertThat(removed).isEqualTo(2);
      assertThat(cache.size()).isZero();
    }
  }

  @Nested
  @DisplayName("keys")
  class Keys {

    @Test
    @DisplayName("커서를 따라가면 일치하는 키를 정확히 한 번씩 방문한다")
    void paginatesEachKeyOnce() {
      for (String key : List.of("user:3", "user:1", "order:1", "user:2", "user:5", "user:4")) {
        cache.set(key, "v");
      }

      List<String> visited = new ArrayList<>();
      long cursor = 0L;
      int pages = 0;
      do {
        KeysPage page = cache.keys("user:*", cursor, 2, null);
        visited.addAll(page.keys());
        cursor = page.cursor();
        pages++;
      } while (cursor != 0L);

      assertThat(visited).containsExactly("user:1", "user:2", "user:3", "user:4", "user:5");
      assertThat(pages).isEqualTo(3);
    }

    @Test
    @DisplayName("만료된 키는 나열되지 않는다")
    void skipsExpiredKeys() {
      cache.set("a", "1", Duration.ofSeconds(1));
      cache.set("b", "2");
      clock.advance(Duration.ofSeconds(1));

      assertThat(cache.keys("*").keys()).containsExactly("b");
    }
  }

  @Nested
  @DisplayName("오류 처리")
  class Errors {

    @Test
    @DisplayName("디코딩할 수 없는 값은 CacheSerializationException으로 드러난다")
    void corruptPayload() throws Exception {
      try (Connection connection = rawConnection();
          PreparedStatement insert =
              connection.prepareStatement(
                  "INSERT INTO cache_entries(key, value, expires_at, last_access, created_at)"
                      + " VALUES (?, ?, NULL, 0, 0)")) {
        insert.setString(1, "broken");
        insert.setBytes(2, new byte[] {(byte) 0xC3, (byte) 0x28});
        insert.executeUpdate();
      }

      assertThatThrownBy(() -> cache.get("broken"))
          .isInstanceOf(CacheSerializationException.class);
    }

    @Test
    @DisplayName("빈 키와 null 값은 거부한다")
    void rejectsInvalidArguments() {
      assertThatThrownBy(() -> cache.get("")).isInstanceOf(InvalidCacheArgumentException.class);
      assertThatThrownBy(() -> cache.set("k", null))
          .isInstanceOf(InvalidCacheArgumentException.class);
    }

    @Test
    @DisplayName("codec 없이 만들 수 없다")
    void codecRequired() {
      assertThatThrownBy(() -> SqliteCacheBackend.<String>builder().path(dbPath).build())
          .isInstanceOf(InvalidCacheArgumentException.class);
    }
  }

  @Nested
  @DisplayName("Hot reload")
  class HotReload {

    @Test
    @DisplayName("저장소 파일이 바뀌면 재로드 횟수와 시각을 기록한다")
    void detectsFileChange() throws Exception {
      reopenWithHotReload();
      cache.get("k");
      assertThat(cache.getReloadCount()).isZero();

      Files.setLastModifiedTime(
          dbPath,
          FileTime.fromMillis(System.currentTimeMillis() + TimeUnit.MINUTES.toMillis(10)));
      cache.get("k");

      assertThat(cache.getReloadCount()).isEqualTo(1);
      assertThat(cache.getLastReloadTime()).contains(clock.instant());
    }

    @Test
    @DisplayName("비활성 상태에서는 변경을 추적하지 않는다")
    void disabledByDefault() throws Exception {
      Files.setLastModifiedTime(
          dbPath,
          FileTime.fromMillis(System.currentTimeMillis() + TimeUnit.MINUTES.toMillis(10)));
      cache.get("k");

      assertThat(cache.getReloadCount()).isZero();
      assertThat(cache.getLastReloadTime()).isEmpty();
    }

    private void reopenWithHotReload() {
      cache.close();
      cache = open(100, true);
    }
  }

  @Nested
  @DisplayName("수명주기와 Async")
  class Lifecycle {

    @Test
    @DisplayName("Async 연산은 같은 결과를 돌려준다")
    void asyncOperations() {
      assertThat(cache.setAsync("k", "v", null).join()).isTrue();
      assertThat(cache.getAsync("k").join()).contains("v");
      assertThat(cache.deleteAsync("k").join()).isTrue();
      assertThat(cache.existsAsync("k").join()).isFalse();
    }

    @Test
    @DisplayName("헬스 체크는 열려 있을 때만 true이고 close는 여러 번 호출해도 된다")
    void healthAndIdempotentClose() {
      assertThat(cache.checkHealth()).isTrue();
      assertThat(cache.exists(CacheBackend.HEALTH_CHECK_KEY)).isFalse();

      cache.close();
      cache.close();

      assertThat(cache.checkHealth()).isFalse();
    }

    @Test
    @DisplayName("clear는 모든 항목을 지운다")
    void clearRemovesEverything() {
      cache.set("a", "1");
      cache.set("b", "2", Duration.ofMinutes(1));

      cache.clear();

      assertThat(cache.size()).isZero();
    }
  }
}
