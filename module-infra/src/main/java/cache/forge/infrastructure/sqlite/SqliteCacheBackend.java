package cache.forge.infrastructure.sqlite;

import static cache.forge.infrastructure.sqlite.SqliteStatements.COUNT_ALL;
import static cache.forge.infrastructure.sqlite.SqliteStatements.COUNT_KEY;
import static cache.forge.infrastructure.sqlite.SqliteStatements.COUNT_LIVE_KEY;
import static cache.forge.infrastructure.sqlite.SqliteStatements.CREATE_EXPIRES_INDEX;
import static cache.forge.infrastructure.sqlite.SqliteStatements.CREATE_LAST_ACCESS_INDEX;
import static cache.forge.infrastructure.sqlite.SqliteStatements.CREATE_TABLE;
import static cache.forge.infrastructure.sqlite.SqliteStatements.DELETE_ALL;
import static cache.forge.infrastructure.sqlite.SqliteStatements.DELETE_EXPIRED;
import static cache.forge.infrastructure.sqlite.SqliteStatements.DELETE_EXPIRED_KEY;
import static cache.forge.infrastructure.sqlite.SqliteStatements.DELETE_KEY;
import static cache.forge.infrastructure.sqlite.SqliteStatements.DELETE_LIVE_KEY;
import static cache.forge.infrastructure.sqlite.SqliteStatements.ENABLE_WAL;
import static cache.forge.infrastructure.sqlite.SqliteStatements.EVICT_LRU;
import static cache.forge.infrastructure.sqlite.SqliteStatements.SELECT_ENTRY;
import static cache.forge.infrastructure.sqlite.SqliteStatements.SELECT_EXPIRES_AT;
import static cache.forge.infrastructure.sqlite.SqliteStatements.SELECT_LIVE_KEYS;
import static cache.forge.infrastructure.sqlite.SqliteStatements.TOUCH;
import static cache.forge.infrastructure.sqlite.SqliteStatements.UPSERT;

import cache.forge.codec.CacheCodec;
import cache.forge.core.backend.AbstractOffloadingCacheBackend;
import cache.forge.core.backend.CacheEntry;
import cache.forge.core.backend.CacheKeys;
import cache.forge.core.backend.ExpirySweeper;
import cache.forge.core.backend.GlobPattern;
import cache.forge.core.backend.KeysPage;
import cache.forge.error.exception.InvalidCacheArgumentException;
import cache.forge.infrastructure.executor.DefaultLogicExecutor;
import cache.forge.infrastructure.executor.LogicExecutor;
import cache.forge.infrastructure.executor.TaskContext;
import cache.forge.infrastructure.executor.strategy.ExceptionTranslator;
import com.zaxxer.hikari.HikariDataSource;
import io.micrometer.core.instrument.Metrics;
import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.SqlParameterValue;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * SQLite 기반 영속 캐시 엔진
 *
 * <h3>저장 구조</h3>
 *
 * <p>단일 테이블 {@code cache_entries(key, value, expires_at, last_access, created_at)}에 코덱으로 인코딩한 값을
 * 저장하며, WAL 모드로 열어 읽기와 쓰기가 서로를 막지 않도록 합니다. 프로세스를 재시작해도 항목이 유지됩니다.
 *
 * <h3>동시성</h3>
 *
 * <ul>
 *   <li>여러 문장으로 이루어진 연산(조회+touch, purge+NX 검사+upsert+제거)은 엔진 뮤텍스와 한 트랜잭션 안에서 실행
 *   <li>커넥션은 {@code BEGIN IMMEDIATE}로 트랜잭션을 시작하므로 다른 프로세스의 쓰기와도 직렬화됨
 *   <li>Async 연산은 엔진 소유 데몬 스레드 풀에서 블로킹 JDBC를 실행
 * </ul>
 *
 * <h3>LRU 제거</h3>
 *
 * <p>새 키를 넣은 뒤 행 수가 {@code maxSize}를 넘으면 {@code last_access}가 가장 작은 행부터 초과분을 한 문장으로 삭제합니다.
 * {@code last_access}는 프로세스 안에서 단조 증가하므로 같은 시각에 접근한 항목도 순서가 정해집니다.
 *
 * <h3>Hot reload</h3>
 *
 * <p>활성화하면 {@code get}마다 저장소 파일(WAL 파일 포함)의 수정 시각을 확인하고, 변경되었으면 재로드 시각과 횟수를 기록합니다. 데이터는
 * 항상 저장소에서 직접 읽으므로 진단 용도입니다.
 *
 * @param <V> 값 타입
 */
@Slf4j
public class SqliteCacheBackend<V> extends AbstractOffloadingCacheBackend<V> {

  public static final Path DEFAULT_PATH = Path.of("./cache-forge.db");
  public static final int DEFAULT_MAX_SIZE = 10_000;
  public static final Duration DEFAULT_CLEANUP_INTERVAL = Duration.ofSeconds(300);
  public static final int DEFAULT_POOL_SIZE = 4;
  public static final Duration DEFAULT_BUSY_TIMEOUT = Duration.ofSeconds(5);

  private static final String COMPONENT = "SqliteCache";
  private static final double ACCESS_TICK = 1e-6;
  private static final byte[] HEALTH_MARKER = "ok".getBytes(StandardCharsets.UTF_8);

  private static final RowMapper<StoredEntry> ENTRY_MAPPER =
      (rs, rowNum) -> new StoredEntry(rs.getBytes(1), nullableDouble(rs, 2));

  @Getter private final Path path;
  private final int maxSize;
  private final CacheCodec<V> codec;
  private final Clock clock;
  private final LogicExecutor executor;
  private final boolean hotReload;

  private final HikariDataSource dataSource;
  private final JdbcTemplate jdbc;
  private final TransactionTemplate tx;
  private final ReentrantLock lock = new ReentrantLock();
  private final ExecutorService ioExecutor;
  private final ExpirySweeper sweeper;
  private final AtomicBoolean closed = new AtomicBoolean(false);

  private final AtomicLong observedMtime = new AtomicLong();
  private final AtomicLong reloadCount = new AtomicLong();
  private volatile Instant lastReloadTime;

  // lock 보유 중에만 접근
  private double lastIssuedAccess;

  /**
   * @param path 저장소 파일 (기본 {@code ./cache-forge.db}), 상위 디렉터리는 자동 생성
   * @param maxSize 최대 행 수 (기본 10,000), 0이면 모든 쓰기가 {@code false}
   * @param codec 값 코덱 (필수)
   * @param cleanupInterval 만료 행 sweep 주기 (기본 300초), {@link Duration#ZERO}이면 sweeper 없음
   * @param hotReload 파일 변경 감지 여부 (기본 {@code false})
   * @param poolSize 커넥션 풀 및 Async 스레드 수 (기본 4)
   * @param busyTimeout SQLite busy_timeout (기본 5초)
   * @param clock 만료 판정용 시계
   * @param executor 저장소 호출 실행 템플릿 (기본 전역 MeterRegistry 사용)
   */
  @Builder
  private SqliteCacheBackend(
      Path path,
      Integer maxSize,
      CacheCodec<V> codec,
      Duration cleanupInterval,
      Boolean hotReload,
      Integer poolSize,
      Duration busyTimeout,
      Clock clock,
      LogicExecutor executor) {
    if (codec == null) {
      throw new InvalidCacheArgumentException("codec must not be null");
    }
    this.path = path == null ? DEFAULT_PATH : path;
    this.maxSize = maxSize == null ? DEFAULT_MAX_SIZE : maxSize;
    if (this.maxSize < 0) {
      throw new InvalidCacheArgumentException("maxSize=" + maxSize);
    }
    int pool = poolSize == null ? DEFAULT_POOL_SIZE : poolSize;
    if (pool <= 0) {
      throw new InvalidCacheArgumentException("poolSize=" + poolSize);
    }
    this.codec = codec;
    this.clock = clock == null ? Clock.systemUTC() : clock;
    this.executor = executor == null ? new DefaultLogicExecutor(Metrics.globalRegistry) : executor;
    this.hotReload = Boolean.TRUE.equals(hotReload);

    Duration busy = busyTimeout == null ? DEFAULT_BUSY_TIMEOUT : busyTimeout;
    TaskContext openContext = context("Open", this.path.toString());
    Path parent = this.path.toAbsolutePath().getParent();
    this.executor.executeVoid(() -> Files.createDirectories(parent), openContext);
    this.dataSource =
        this.executor.executeWithTranslation(
            () -> SqliteDataSources.open(this.path, pool, busy),
            ExceptionTranslator.forSqlite(),
            openContext);
    this.jdbc = new JdbcTemplate(dataSource);
    this.tx = new TransactionTemplate(new DataSourceTransactionManager(dataSource));
    try {
      initializeSchema(openContext);
    } catch (RuntimeException e) {
      dataSource.close();
      throw e;
    }
    this.observedMtime.set(currentMtime());

    this.ioExecutor = Executors.newFixedThreadPool(pool, daemonThreads("cache-forge-sqlite-io-"));
    Duration interval = cleanupInterval == null ? DEFAULT_CLEANUP_INTERVAL : cleanupInterval;
    this.sweeper =
        interval.isZero()
            ? null
            : ExpirySweeper.start("cache-forge-sqlite-sweeper", interval, this::sweepExpired);
    log.info(
        "[SqliteCache] 초기화 (path: {}, maxSize: {}, cleanupInterval: {}, hotReload: {})",
        this.path,
        this.maxSize,
        interval,
        this.hotReload);
  }

  private void initializeSchema(TaskContext openContext) {
    String journalMode =
        executor.executeWithTranslation(
            () -> {
              String mode = jdbc.queryForObject(ENABLE_WAL, String.class);
              jdbc.execute(CREATE_TABLE);
              jdbc.execute(CREATE_EXPIRES_INDEX);
              jdbc.execute(CREATE_LAST_ACCESS_INDEX);
              return mode;
            },
            ExceptionTranslator.forSqlite(),
            openContext);
    log.debug("[SqliteCache] 스키마 준비 완료 (journal_mode: {})", journalMode);
  }

  // ==================== 단일 키 연산 ====================

  @Override
  public Optional<V> get(String key) {
    CacheKeys.requireValid(key);
    checkHotReload();
    byte[] payload =
        executor.executeWithTranslation(
            () -> inLockedTransaction(() -> readAndTouch(key, nowSeconds())),
            ExceptionTranslator.forSqlite(),
            context("Get", key));
    return payload == null ? Optional.empty() : Optional.of(codec.deserialize(payload));
  }

  @Override
  public boolean set(String key, V value, Duration ttl, boolean nx) {
    CacheKeys.requireValid(key);
    CacheKeys.requireValue(value);
    if (maxSize == 0) {
      return false;
    }
    // 직렬화 실패 시 아무것도 쓰지 않는다
    byte[] payload = codec.serialize(value);
    Boolean written =
        executor.executeWithTranslation(
            () -> inLockedTransaction(() -> write(key, payload, ttl, nx, clock.instant())),
            ExceptionTranslator.forSqlite(),
            context("Set", key));
    return Boolean.TRUE.equals(written);
  }

  @Override
  public boolean delete(String key) {
    CacheKeys.requireValid(key);
    Boolean removed =
        executor.executeWithTranslation(
            () -> inLockedTransaction(() -> remove(key, nowSeconds())),
            ExceptionTranslator.forSqlite(),
            context("Delete", key));
    return Boolean.TRUE.equals(removed);
  }

  @Override
  public boolean exists(String key) {
    CacheKeys.requireValid(key);
    Integer count =
        executor.executeWithTranslation(
            () -> jdbc.queryForObject(COUNT_LIVE_KEY, Integer.class, key, nowSeconds()),
            ExceptionTranslator.forSqlite(),
            context("Exists", key));
    return count != null && count > 0;
  }

  @Override
  public void clear() {
    Integer removed =
        executor.executeWithTranslation(
            () -> inLockedTransaction(() -> jdbc.update(DELETE_ALL)),
            ExceptionTranslator.forSqlite(),
            context("Clear", null));
    log.debug("[SqliteCache] 전체 삭제 ({}건)", removed);
  }

  // ==================== 배치 연산 (한 트랜잭션) ====================

  @Override
  public Map<String, V> getMany(Collection<String> keys) {
    CacheKeys.requireValid(keys);
    checkHotReload();
    Map<String, byte[]> payloads =
        executor.executeWithTranslation(
            () ->
                inLockedTransaction(
                    () -> {
                      double now = nowSeconds();
                      Map<String, byte[]> found = new LinkedHashMap<>();
                      for (String key : keys) {
                        byte[] payload = readAndTouch(key, now);
                        if (payload != null) {
                          found.put(key, payload);
                        }
                      }
                      return found;
                    }),
            ExceptionTranslator.forSqlite(),
            context("GetMany", keys.size() + " keys"));
    Map<String, V> decoded = new LinkedHashMap<>();
    payloads.forEach((key, payload) -> decoded.put(key, codec.deserialize(payload)));
    return decoded;
  }

  @Override
  public void setMany(Map<String, ? extends V> entries, Duration ttl) {
    CacheKeys.requireEntries(entries);
    if (maxSize == 0 || entries.isEmpty()) {
      return;
    }
    Map<String, byte[]> payloads = new LinkedHashMap<>();
    entries.forEach((key, value) -> payloads.put(key, codec.serialize(value)));
    executor.executeWithTranslation(
        () ->
            inLockedTransaction(
                () -> {
                  Instant now = clock.instant();
                  payloads.forEach((key, payload) -> write(key, payload, ttl, false, now));
                  return payloads.size();
                }),
        ExceptionTranslator.forSqlite(),
        context("SetMany", payloads.size() + " keys"));
  }

  @Override
  public int deleteMany(Collection<String> keys) {
    CacheKeys.requireValid(keys);
    Integer removed =
        executor.executeWithTranslation(
            () ->
                inLockedTransaction(
                    () -> {
                      double now = nowSeconds();
                      int count = 0;
                      for (String key : keys) {
                        if (remove(key, now)) {
                          count++;
                        }
                      }
                      return count;
                    }),
            ExceptionTranslator.forSqlite(),
            context("DeleteMany", keys.size() + " keys"));
    return removed == null ? 0 : removed;
  }

  // ==================== 조회성 연산 ====================

  /** live 키를 글롭으로 거른 뒤 사전순 정렬, 오프셋 커서로 페이지를 자릅니다. */
  @Override
  public KeysPage keys(String pattern, long cursor, int count, Integer maxKeys) {
    GlobPattern glob = GlobPattern.compile(pattern);
    KeysPage.pageLimit(count, maxKeys);
    List<String> live =
        executor.executeWithTranslation(
            () -> jdbc.queryForList(SELECT_LIVE_KEYS, String.class, nowSeconds()),
            ExceptionTranslator.forSqlite(),
            context("Keys", pattern));
    List<String> matches =
        live.stream().filter(glob::matches).sorted().collect(Collectors.toList());
    return KeysPage.slice(matches, cursor, count, maxKeys);
  }

  @Override
  public long ttl(String key) {
    CacheKeys.requireValid(key);
    return executor.executeWithTranslation(
        () -> {
          double now = nowSeconds();
          List<Optional<Double>> rows =
              jdbc.query(
                  SELECT_EXPIRES_AT,
                  (rs, rowNum) -> Optional.ofNullable(nullableDouble(rs, 1)),
                  key);
          if (rows.isEmpty()) {
            return TTL_ABSENT;
          }
          Optional<Double> expiresAt = rows.get(0);
          if (expiresAt.isEmpty()) {
            return TTL_NO_EXPIRY;
          }
          if (expiresAt.get() <= now) {
            return TTL_ABSENT;
          }
          double remainingMillis = (expiresAt.get() - now) * 1000.0;
          if (remainingMillis >= Long.MAX_VALUE) {
            return (long) Math.ceil(expiresAt.get() - now);
          }
          return CacheEntry.ceilSeconds(Math.round(remainingMillis));
        },
        ExceptionTranslator.forSqlite(),
        context("Ttl", key));
  }

  /** 만료되었지만 아직 sweep되지 않은 행도 포함합니다. */
  @Override
  public long size() {
    Integer count =
        executor.executeWithTranslation(
            () -> jdbc.queryForObject(COUNT_ALL, Integer.class),
            ExceptionTranslator.forSqlite(),
            context("Size", null));
    return count == null ? 0L : count;
  }

  @Override
  public boolean checkHealth() {
    if (closed.get()) {
      return false;
    }
    return executor.executeOrDefault(
        () ->
            inLockedTransaction(
                () -> {
                  double now = nowSeconds();
                  jdbc.update(UPSERT, HEALTH_CHECK_KEY, HEALTH_MARKER, now + 1.0, now, now);
                  List<StoredEntry> rows =
                      jdbc.query(SELECT_ENTRY, ENTRY_MAPPER, HEALTH_CHECK_KEY);
                  jdbc.update(DELETE_KEY, HEALTH_CHECK_KEY);
                  return !rows.isEmpty() && Arrays.equals(rows.get(0).value(), HEALTH_MARKER);
                }),
        false,
        context("HealthCheck", null));
  }

  /** 만료된 행을 모두 삭제합니다. 백그라운드 sweeper가 주기적으로 호출합니다. */
  public int sweepExpired() {
    Integer removed =
        executor.executeWithTranslation(
            () -> inLockedTransaction(() -> jdbc.update(DELETE_EXPIRED, nowSeconds())),
            ExceptionTranslator.forSqlite(),
            context("Sweep", null));
    return removed == null ? 0 : removed;
  }

  // ==================== Hot reload 진단 ====================

  public long getReloadCount() {
    return reloadCount.get();
  }

  public Optional<Instant> getLastReloadTime() {
    return Optional.ofNullable(lastReloadTime);
  }

  private void checkHotReload() {
    if (!hotReload) {
      return;
    }
    long mtime = currentMtime();
    long previous = observedMtime.get();
    if (mtime > previous && observedMtime.compareAndSet(previous, mtime)) {
      lastReloadTime = clock.instant();
      long count = reloadCount.incrementAndGet();
      log.debug("[SqliteCache] 저장소 파일 변경 감지 (path: {}, reload #{})", path, count);
    }
  }

  // 파일이 없으면 0
  private long currentMtime() {
    File wal = new File(path.toAbsolutePath() + "-wal");
    return Math.max(path.toFile().lastModified(), wal.lastModified());
  }

  // ==================== 수명주기 ====================

  @Override
  protected Executor asyncExecutor() {
    return ioExecutor;
  }

  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    if (sweeper != null) {
      sweeper.close();
    }
    ioExecutor.shutdown();
    try {
      if (!ioExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
        log.warn("[SqliteCache] Async 작업이 5초 내 끝나지 않아 강제 종료");
        ioExecutor.shutdownNow();
      }
    } catch (InterruptedException e) {
      ioExecutor.shutdownNow();
      Thread.currentThread().interrupt();
    }
    dataSource.close();
    log.info("[SqliteCache] 종료 (path: {})", path);
  }

  // ==================== lock + 트랜잭션 안에서만 호출 ====================

  private <T> T inLockedTransaction(Supplier<T> work) {
    lock.lock();
    try {
      return tx.execute(status -> work.get());
    } finally {
      lock.unlock();
    }
  }

  private byte[] readAndTouch(String key, double now) {
    List<StoredEntry> rows = jdbc.query(SELECT_ENTRY, ENTRY_MAPPER, key);
    if (rows.isEmpty()) {
      return null;
    }
    StoredEntry entry = rows.get(0);
    if (entry.isExpiredAt(now)) {
      jdbc.update(DELETE_KEY, key);
      return null;
    }
    jdbc.update(TOUCH, nextAccessTime(now), key);
    return entry.value();
  }

  private boolean write(String key, byte[] payload, Duration ttl, boolean nx, Instant at) {
    double now = epochSeconds(at);
    jdbc.update(DELETE_EXPIRED_KEY, key, now);
    boolean existed = count(COUNT_KEY, key) > 0;
    if (nx && existed) {
      return false;
    }
    Double expiresAt = ttl == null ? null : epochSeconds(CacheEntry.expiresAt(at, ttl));
    jdbc.update(
        UPSERT,
        key,
        payload,
        new SqlParameterValue(Types.REAL, expiresAt),
        nextAccessTime(now),
        now);
    if (!existed) {
      evictOverflow();
    }
    return true;
  }

  private void evictOverflow() {
    int overflow = count(COUNT_ALL) - maxSize;
    if (overflow > 0) {
      int evicted = jdbc.update(EVICT_LRU, overflow);
      log.debug("[SqliteCache] 용량 초과로 LRU 항목 {}건 제거", evicted);
    }
  }

  private boolean remove(String key, double now) {
    int live = jdbc.update(DELETE_LIVE_KEY, key, now);
    if (live == 0) {
      jdbc.update(DELETE_KEY, key);
    }
    return live > 0;
  }

  private int count(String sql, Object... args) {
    Integer count = jdbc.queryForObject(sql, Integer.class, args);
    return count == null ? 0 : count;
  }

  private double nextAccessTime(double now) {
    double next = Math.max(now, lastIssuedAccess + ACCESS_TICK);
    lastIssuedAccess = next;
    return next;
  }

  // ==================== helpers ====================

  private double nowSeconds() {
    return epochSeconds(clock.instant());
  }

  static double epochSeconds(Instant instant) {
    return instant.getEpochSecond() + instant.getNano() / 1_000_000_000.0;
  }

  private static Double nullableDouble(ResultSet rs, int column) throws SQLException {
    double value = rs.getDouble(column);
    return rs.wasNull() ? null : value;
  }

  private static TaskContext context(String operation, String key) {
    return TaskContext.of(COMPONENT, operation, key);
  }

  private static ThreadFactory daemonThreads(String prefix) {
    AtomicInteger sequence = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable, prefix + sequence.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    };
  }

  private record StoredEntry(byte[] value, Double expiresAt) {

    boolean isExpiredAt(double now) {
      return expiresAt != null && expiresAt <= now;
    }
  }
}
