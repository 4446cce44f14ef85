package cache.forge.infrastructure.redis;

import cache.forge.codec.CacheCodec;
import cache.forge.common.function.ThrowingSupplier;
import cache.forge.core.backend.CacheBackend;
import cache.forge.core.backend.CacheKeys;
import cache.forge.core.backend.KeysPage;
import cache.forge.error.exception.InvalidCacheArgumentException;
import cache.forge.infrastructure.executor.DefaultLogicExecutor;
import cache.forge.infrastructure.executor.LogicExecutor;
import cache.forge.infrastructure.executor.TaskContext;
import cache.forge.infrastructure.executor.strategy.ExceptionTranslator;
import cache.forge.infrastructure.redis.ScanContinuations.Position;
import io.micrometer.core.instrument.Metrics;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.BatchOptions;
import org.redisson.api.RBatch;
import org.redisson.api.RBucket;
import org.redisson.api.RBucketAsync;
import org.redisson.api.RScript;
import org.redisson.api.RedissonClient;
import org.redisson.client.codec.ByteArrayCodec;
import org.redisson.client.codec.StringCodec;

/**
 * Redisson 기반 원격 캐시 엔진
 *
 * <h3>키 매핑</h3>
 *
 * <p>모든 키는 {@code "{keyPrefix}{key}"}로 저장됩니다. 값은 코덱으로 인코딩한 바이트 그대로 {@link ByteArrayCodec}으로
 * 저장하므로 Redisson 기본 코덱을 거치지 않습니다.
 *
 * <h3>만료</h3>
 *
 * <p>양수 TTL은 Redis의 상대 만료({@code PX})를 사용합니다. TTL이 없거나 0 이하이면 만료 없이 저장합니다. 만료 판정과 LRU는 Redis
 * 서버가 담당하므로 로컬 락이나 sweeper가 없습니다.
 *
 * <h3>키 나열</h3>
 *
 * <p>{@code keys()}는 호출당 {@code SCAN} 한 번을 실행합니다. 한도를 넘긴 키는 {@link ScanContinuations}에 보관했다가 다음
 * 페이지에서 먼저 돌려줍니다. SCAN 특성상 스캔 도중 바뀐 키는 중복되거나 빠질 수 있습니다.
 *
 * <h3>Async</h3>
 *
 * <p>Redisson의 {@code RFuture}를 그대로 {@link CompletableFuture}로 노출하므로 별도 스레드 풀이 없습니다.
 *
 * @param <V> 값 타입
 */
@Slf4j
public class RedisCacheBackend<V> implements CacheBackend<V> {

  public static final String DEFAULT_ADDRESS = "redis://localhost:6379";
  public static final String DEFAULT_KEY_PREFIX = "cacheforge:";
  public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);
  public static final int DEFAULT_CONNECTION_POOL_SIZE = 50;
  public static final Duration DEFAULT_CONTINUATION_TTL = Duration.ofMinutes(5);

  private static final String COMPONENT = "RedisCache";
  private static final byte[] HEALTH_MARKER = "ok".getBytes(StandardCharsets.UTF_8);
  private static final Duration HEALTH_MARKER_TTL = Duration.ofSeconds(10);
  // Redis는 현재 시각 + PX가 long 범위를 넘으면 거부
  static final Duration MAX_TTL = Duration.ofMillis(Long.MAX_VALUE / 2);

  /** SCAN 한 번. 결과는 {@code [nextCursor, [keys...]]} */
  static final String SCAN_SCRIPT =
      "return redis.call('SCAN', ARGV[1], 'MATCH', ARGV[2], 'COUNT', ARGV[3])";

  private final RedissonClient redisson;
  private final boolean ownsClient;
  @Getter private final String keyPrefix;
  private final String escapedPrefix;
  private final CacheCodec<V> codec;
  private final LogicExecutor executor;
  private final ScanContinuations continuations;
  private final AtomicBoolean closed = new AtomicBoolean(false);

  /**
   * {@code client}를 넘기면 그 클라이언트를 빌려 쓰고 {@link #close()}에서 종료하지 않습니다. 넘기지 않으면 연결 설정으로 새 클라이언트를
   * 만들고 직접 소유합니다.
   *
   * @param client 외부에서 관리하는 Redisson 클라이언트 (선택)
   * @param address Redis 주소 (기본 {@code redis://localhost:6379})
   * @param password 인증 비밀번호 (선택)
   * @param database DB 번호 (기본 0)
   * @param timeout 명령 응답 타임아웃 (기본 5초)
   * @param connectTimeout 연결 타임아웃 (기본 5초)
   * @param connectionPoolSize 커넥션 풀 크기 (기본 50)
   * @param keyPrefix 키 네임스페이스 (기본 {@code cacheforge:})
   * @param codec 값 코덱 (필수)
   * @param executor 저장소 호출 실행 템플릿 (기본 전역 MeterRegistry 사용)
   * @param continuationTtl SCAN 이어받기 토큰 유지 시간 (기본 5분)
   */
  @Builder
  private RedisCacheBackend(
      RedissonClient client,
      String address,
      String password,
      Integer database,
      Duration timeout,
      Duration connectTimeout,
      Integer connectionPoolSize,
      String keyPrefix,
      CacheCodec<V> codec,
      LogicExecutor executor,
      Duration continuationTtl) {
    if (codec == null) {
      throw new InvalidCacheArgumentException("codec must not be null");
    }
    this.codec = codec;
    this.keyPrefix = keyPrefix == null ? DEFAULT_KEY_PREFIX : keyPrefix;
    this.escapedPrefix = escapeGlob(this.keyPrefix);
    this.executor = executor == null ? new DefaultLogicExecutor(Metrics.globalRegistry) : executor;
    this.continuations =
        new ScanContinuations(
            continuationTtl == null ? DEFAULT_CONTINUATION_TTL : continuationTtl);
    if (client != null) {
      this.redisson = client;
      this.ownsClient = false;
    } else {
      int pool = connectionPoolSize == null ? DEFAULT_CONNECTION_POOL_SIZE : connectionPoolSize;
      if (pool <= 0) {
        throw new InvalidCacheArgumentException("connectionPoolSize=" + connectionPoolSize);
      }
      this.redisson =
          RedissonClientFactory.create(
              address == null ? DEFAULT_ADDRESS : address,
              password,
              database == null ? 0 : database,
              connectTimeout == null ? DEFAULT_TIMEOUT : connectTimeout,
              timeout == null ? DEFAULT_TIMEOUT : timeout,
              pool);
      this.ownsClient = true;
    }
    log.info("[RedisCache] 초기화 (keyPrefix: {}, ownsClient: {})", this.keyPrefix, ownsClient);
  }

  // ==================== 단일 키 연산 ====================

  @Override
  public Optional<V> get(String key) {
    CacheKeys.requireValid(key);
    byte[] payload = call("Get", key, () -> bucket(key).get());
    return decode(payload);
  }

  @Override
  public boolean set(String key, V value, Duration ttl, boolean nx) {
    CacheKeys.requireValid(key);
    CacheKeys.requireValue(value);
    byte[] payload = codec.serialize(value);
    Duration expiry = effectiveTtl(key, ttl);
    return call(
        "Set",
        key,
        () -> {
          RBucket<byte[]> bucket = bucket(key);
          if (nx) {
            return expiry == null
                ? bucket.setIfAbsent(payload)
                : bucket.setIfAbsent(payload, expiry);
          }
          if (expiry == null) {
            bucket.set(payload);
          } else {
            bucket.set(payload, expiry);
          }
          return true;
        });
  }

  @Override
  public boolean delete(String key) {
    CacheKeys.requireValid(key);
    return call("Delete", key, () -> bucket(key).delete());
  }

  @Override
  public boolean exists(String key) {
    CacheKeys.requireValid(key);
    return call("Exists", key, () -> bucket(key).isExists());
  }

  /** prefix가 붙은 키만 지웁니다. 같은 DB의 다른 데이터는 건드리지 않습니다. */
  @Override
  public void clear() {
    long removed =
        call("Clear", null, () -> redisson.getKeys().deleteByPattern(escapedPrefix + "*"));
    log.debug("[RedisCache] 전체 삭제 ({}건, prefix: {})", removed, keyPrefix);
  }

  // ==================== 배치 연산 ====================

  /** {@code MGET} 한 번으로 조회합니다. 없는 키는 결과에서 빠집니다. */
  @Override
  public Map<String, V> getMany(Collection<String> keys) {
    CacheKeys.requireValid(keys);
    if (keys.isEmpty()) {
      return Map.of();
    }
    Map<String, byte[]> payloads =
        call(
            "GetMany",
            keys.size() + " keys",
            () -> redisson.getBuckets(ByteArrayCodec.INSTANCE).<byte[]>get(fullKeys(keys)));
    return decodeAll(keys, payloads);
  }

  /** 한 번의 파이프라인({@link RBatch})으로 씁니다. */
  @Override
  public void setMany(Map<String, ? extends V> entries, Duration ttl) {
    CacheKeys.requireEntries(entries);
    if (entries.isEmpty()) {
      return;
    }
    RBatch batch = prepareBatch(entries, ttl);
    call("SetMany", entries.size() + " keys", batch::execute);
  }

  /** 다중 키 {@code DEL} 한 번 */
  @Override
  public int deleteMany(Collection<String> keys) {
    CacheKeys.requireValid(keys);
    if (keys.isEmpty()) {
      return 0;
    }
    long removed =
        call("DeleteMany", keys.size() + " keys", () -> redisson.getKeys().delete(fullKeys(keys)));
    return Math.toIntExact(removed);
  }

  // ==================== 조회성 연산 ====================

  @Override
  public KeysPage keys(String pattern, long cursor, int count, Integer maxKeys) {
    requirePattern(pattern);
    int limit = KeysPage.pageLimit(count, maxKeys);
    Position position = continuations.resume(cursor, pattern);
    if (!needsScan(position, limit)) {
      return nextPage(position, null, limit);
    }
    List<Object> reply =
        call(
            "Keys",
            pattern,
            () ->
                redisson
                    .getScript(StringCodec.INSTANCE)
                    .eval(
                        RScript.Mode.READ_ONLY,
                        SCAN_SCRIPT,
                        RScript.ReturnType.MULTI,
                        Collections.emptyList(),
                        position.redisCursor(),
                        escapedPrefix + pattern,
                        String.valueOf(count)));
    return nextPage(position, reply, limit);
  }

  /** {@code PTTL}을 초 단위로 올림합니다. */
  @Override
  public long ttl(String key) {
    CacheKeys.requireValid(key);
    long millis = call("Ttl", key, () -> bucket(key).remainTimeToLive());
    return toSeconds(millis);
  }

  /** prefix가 붙은 키 수. SCAN으로 세므로 키가 많으면 느립니다. */
  @Override
  public long size() {
    return call(
        "Size",
        null,
        () -> {
          long count = 0;
          for (String ignored : redisson.getKeys().getKeysByPattern(escapedPrefix + "*")) {
            count++;
          }
          return count;
        });
  }

  @Override
  public boolean checkHealth() {
    if (closed.get() || redisson.isShutdown()) {
      return false;
    }
    return executor.executeOrDefault(
        () -> {
          RBucket<byte[]> marker = bucket(HEALTH_CHECK_KEY);
          marker.set(HEALTH_MARKER, HEALTH_MARKER_TTL);
          byte[] read = marker.get();
          marker.delete();
          return Arrays.equals(read, HEALTH_MARKER);
        },
        false,
        context("HealthCheck", null));
  }

  // ==================== 카운터 ====================

  /**
   * 원자적으로 {@code delta}만큼 더합니다. 키가 없으면 0에서 시작합니다.
   *
   * <p>카운터는 십진수 문자열로 저장되며 코덱을 거치지 않으므로 {@link #get(String)}으로 읽지 않습니다.
   */
  public long increment(String key, long delta) {
    CacheKeys.requireValid(key);
    return call("Increment", key, () -> redisson.getAtomicLong(fullKey(key)).addAndGet(delta));
  }

  public long decrement(String key, long delta) {
    return increment(key, -delta);
  }

  // ==================== Async (RFuture) ====================

  @Override
  public CompletableFuture<Optional<V>> getAsync(String key) {
    CacheKeys.requireValid(key);
    return async("Get", key, () -> bucket(key).getAsync()).thenApply(this::decode);
  }

  @Override
  public CompletableFuture<Boolean> setAsync(String key, V value, Duration ttl, boolean nx) {
    CacheKeys.requireValid(key);
    CacheKeys.requireValue(value);
    byte[] payload = codec.serialize(value);
    Duration expiry = effectiveTtl(key, ttl);
    if (nx) {
      return async(
          "Set",
          key,
          () ->
              expiry == null
                  ? bucket(key).setIfAbsentAsync(payload)
                  : bucket(key).setIfAbsentAsync(payload, expiry));
    }
    return async(
            "Set",
            key,
            () ->
                expiry == null
                    ? bucket(key).setAsync(payload)
                    : bucket(key).setAsync(payload, expiry))
        .thenApply(ignored -> true);
  }

  @Override
  public CompletableFuture<Boolean> deleteAsync(String key) {
    CacheKeys.requireValid(key);
    return async("Delete", key, () -> bucket(key).deleteAsync());
  }

  @Override
  public CompletableFuture<Boolean> existsAsync(String key) {
    CacheKeys.requireValid(key);
    return async("Exists", key, () -> bucket(key).isExistsAsync());
  }

  @Override
  public CompletableFuture<Void> clearAsync() {
    return async("Clear", null, () -> redisson.getKeys().deleteByPatternAsync(escapedPrefix + "*"))
        .thenApply(removed -> null);
  }

  @Override
  public CompletableFuture<Map<String, V>> getManyAsync(Collection<String> keys) {
    CacheKeys.requireValid(keys);
    if (keys.isEmpty()) {
      return CompletableFuture.completedFuture(Map.of());
    }
    return async(
            "GetMany",
            keys.size() + " keys",
            () -> redisson.getBuckets(ByteArrayCodec.INSTANCE).<byte[]>getAsync(fullKeys(keys)))
        .thenApply(payloads -> decodeAll(keys, payloads));
  }

  @Override
  public CompletableFuture<Void> setManyAsync(Map<String, ? extends V> entries, Duration ttl) {
    CacheKeys.requireEntries(entries);
    if (entries.isEmpty()) {
      return CompletableFuture.completedFuture(null);
    }
    RBatch batch = prepareBatch(entries, ttl);
    return async("SetMany", entries.size() + " keys", batch::executeAsync)
        .thenApply(result -> null);
  }

  @Override
  public CompletableFuture<Integer> deleteManyAsync(Collection<String> keys) {
    CacheKeys.requireValid(keys);
    if (keys.isEmpty()) {
      return CompletableFuture.completedFuture(0);
    }
    return async(
            "DeleteMany",
            keys.size() + " keys",
            () -> redisson.getKeys().deleteAsync(fullKeys(keys)))
        .thenApply(Math::toIntExact);
  }

  @Override
  public CompletableFuture<KeysPage> keysAsync(
      String pattern, long cursor, int count, Integer maxKeys) {
    requirePattern(pattern);
    int limit = KeysPage.pageLimit(count, maxKeys);
    Position position = continuations.resume(cursor, pattern);
    if (!needsScan(position, limit)) {
      return CompletableFuture.completedFuture(nextPage(position, null, limit));
    }
    return this.<List<Object>>async(
            "Keys",
            pattern,
            () ->
                redisson
                    .getScript(StringCodec.INSTANCE)
                    .evalAsync(
                        RScript.Mode.READ_ONLY,
                        SCAN_SCRIPT,
                        RScript.ReturnType.MULTI,
                        Collections.emptyList(),
                        position.redisCursor(),
                        escapedPrefix + pattern,
                        String.valueOf(count)))
        .thenApply(reply -> nextPage(position, reply, limit));
  }

  @Override
  public CompletableFuture<Long> ttlAsync(String key) {
    CacheKeys.requireValid(key);
    return async("Ttl", key, () -> bucket(key).remainTimeToLiveAsync())
        .thenApply(RedisCacheBackend::toSeconds);
  }

  // ==================== 수명주기 ====================

  /** 직접 만든 클라이언트만 종료합니다. 여러 번 호출해도 안전합니다. */
  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    if (ownsClient) {
      redisson.shutdown();
    }
    log.info("[RedisCache] 종료 (keyPrefix: {}, ownsClient: {})", keyPrefix, ownsClient);
  }

  // ==================== SCAN 페이지 조립 ====================

  private static boolean needsScan(Position position, int limit) {
    return position.pending().size() < limit && !position.exhausted();
  }

  /**
   * 보관된 키 뒤에 이번 SCAN 결과를 붙이고 한도만큼 자릅니다. 남은 키가 있거나 SCAN이 끝나지 않았으면 새 토큰을 발급합니다.
   *
   * @param reply SCAN 응답, 이번 호출에서 SCAN하지 않았으면 {@code null}
   */
  private KeysPage nextPage(Position position, List<Object> reply, int limit) {
    List<String> collected = new ArrayList<>(position.pending());
    String redisCursor = position.redisCursor();
    boolean started = position.started();
    if (reply != null) {
      redisCursor = String.valueOf(reply.get(0));
      started = true;
      for (Object rawKey : (List<?>) reply.get(1)) {
        collected.add(stripPrefix(String.valueOf(rawKey)));
      }
    }
    int cut = Math.min(limit, collected.size());
    List<String> page = List.copyOf(collected.subList(0, cut));
    List<String> overflow = List.copyOf(collected.subList(cut, collected.size()));
    Position next = new Position(position.pattern(), redisCursor, overflow, started);
    if (overflow.isEmpty() && next.exhausted()) {
      return new KeysPage(page, 0L, false, page.size());
    }
    return new KeysPage(page, continuations.save(next), true, page.size());
  }

  // ==================== helpers ====================

  private RBucket<byte[]> bucket(String key) {
    return redisson.getBucket(fullKey(key), ByteArrayCodec.INSTANCE);
  }

  private RBatch prepareBatch(Map<String, ? extends V> entries, Duration ttl) {
    Map<String, byte[]> payloads = new LinkedHashMap<>();
    entries.forEach((key, value) -> payloads.put(key, codec.serialize(value)));
    Duration expiry = effectiveTtl(entries.size() + " keys", ttl);
    RBatch batch = redisson.createBatch(BatchOptions.defaults());
    payloads.forEach(
        (key, payload) -> {
          RBucketAsync<byte[]> bucket = batch.getBucket(fullKey(key), ByteArrayCodec.INSTANCE);
          if (expiry == null) {
            bucket.setAsync(payload);
          } else {
            bucket.setAsync(payload, expiry);
          }
        });
    return batch;
  }

  // 0 이하 TTL은 만료 없이 저장
  private static Duration effectiveTtl(String key, Duration ttl) {
    if (ttl == null) {
      return null;
    }
    if (ttl.isNegative() || ttl.isZero()) {
      log.debug("[RedisCache] 0 이하 TTL은 만료 없이 저장 (key: {}, ttl: {})", key, ttl);
      return null;
    }
    if (ttl.compareTo(MAX_TTL) > 0) {
      log.debug("[RedisCache] 허용 범위를 넘는 TTL은 최대값으로 제한 (key: {}, ttl: {})", key, ttl);
      return MAX_TTL;
    }
    return ttl.toMillis() < 1 ? Duration.ofMillis(1) : ttl;
  }

  private Optional<V> decode(byte[] payload) {
    return payload == null ? Optional.empty() : Optional.of(codec.deserialize(payload));
  }

  private Map<String, V> decodeAll(Collection<String> keys, Map<String, byte[]> payloads) {
    Map<String, V> found = new LinkedHashMap<>();
    for (String key : keys) {
      byte[] payload = payloads.get(fullKey(key));
      if (payload != null) {
        found.put(key, codec.deserialize(payload));
      }
    }
    return found;
  }

  private String fullKey(String key) {
    return keyPrefix + key;
  }

  private String[] fullKeys(Collection<String> keys) {
    return keys.stream().map(this::fullKey).toArray(String[]::new);
  }

  private String stripPrefix(String redisKey) {
    return redisKey.startsWith(keyPrefix) ? redisKey.substring(keyPrefix.length()) : redisKey;
  }

  private static void requirePattern(String pattern) {
    if (pattern == null) {
      throw new InvalidCacheArgumentException("pattern must not be null");
    }
  }

  static long toSeconds(long pttlMillis) {
    if (pttlMillis < 0) {
      return pttlMillis == TTL_NO_EXPIRY ? TTL_NO_EXPIRY : TTL_ABSENT;
    }
    return Math.max(1L, (pttlMillis + 999L) / 1000L);
  }

  /** glob 특수문자를 이스케이프해 prefix가 패턴으로 해석되지 않게 합니다. */
  static String escapeGlob(String literal) {
    StringBuilder escaped = new StringBuilder(literal.length());
    for (char c : literal.toCharArray()) {
      if (c == '*' || c == '?' || c == '[' || c == ']' || c == '\\') {
        escaped.append('\\');
      }
      escaped.append(c);
    }
    return escaped.toString();
  }

  private <T> T call(String operation, String key, ThrowingSupplier<T> task) {
    return executor.executeWithTranslation(
        task, ExceptionTranslator.forRedis(), context(operation, key));
  }

  private <T> CompletableFuture<T> async(
      String operation, String key, Supplier<? extends CompletionStage<T>> call) {
    TaskContext context = context(operation, key);
    CompletionStage<T> stage;
    try {
      stage = call.get();
    } catch (RuntimeException e) {
      return CompletableFuture.failedFuture(ExceptionTranslator.forRedis().translate(e, context));
    }
    return stage
        .toCompletableFuture()
        .handle(
            (result, error) -> {
              if (error != null) {
                throw ExceptionTranslator.forRedis().translate(error, context);
              }
              return result;
            });
  }

  private static TaskContext context(String operation, String key) {
    return TaskContext.of(COMPONENT, operation, key);
  }
}
