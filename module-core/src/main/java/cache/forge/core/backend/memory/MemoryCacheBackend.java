package cache.forge.core.backend.memory;

import cache.forge.core.backend.CacheBackend;
import cache.forge.core.backend.CacheEntry;
import cache.forge.core.backend.CacheKeys;
import cache.forge.core.backend.ExpirySweeper;
import cache.forge.core.backend.GlobPattern;
import cache.forge.core.backend.KeysPage;
import cache.forge.error.exception.InvalidCacheArgumentException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;

/**
 * In-process LRU + TTL 캐시 엔진
 *
 * <h3>구조</h3>
 *
 * <ul>
 *   <li>삽입 순서 {@link LinkedHashMap}을 LRU 리스트로 사용: 맨 앞이 가장 오래 사용되지 않은 항목, 맨 뒤가 최근 항목
 *   <li>모든 읽기/쓰기는 하나의 {@link ReentrantLock}으로 직렬화
 *   <li>값은 객체 그대로 보관 (코덱 없음)
 *   <li>Async 연산은 동기 코드를 실행한 뒤 완료된 future를 반환
 * </ul>
 *
 * <h3>용량</h3>
 *
 * <p>새 키를 넣을 때 용량이 가득 차 있으면 LRU 끝 항목을 먼저 제거합니다. 기존 키 갱신은 절대 제거를 일으키지 않습니다. {@code maxSize=0}이면
 * 모든 {@code set}이 {@code false}를 반환합니다.
 *
 * <pre>{@code
 * try (MemoryCacheBackend<String> cache = MemoryCacheBackend.<String>builder().maxSize(1_000).build()) {
 *   cache.set("user:1", "alice", Duration.ofMinutes(5));
 * }
 * }</pre>
 *
 * @param <V> 값 타입
 */
@Slf4j
public class MemoryCacheBackend<V> implements CacheBackend<V> {

  public static final int DEFAULT_MAX_SIZE = 10_000;
  public static final Duration DEFAULT_CLEANUP_INTERVAL = Duration.ofSeconds(60);

  private static final String HEALTH_MARKER = "ok";

  private final int maxSize;
  private final Clock clock;
  private final ReentrantLock lock = new ReentrantLock();
  private final LinkedHashMap<String, CacheEntry<Object>> entries = new LinkedHashMap<>();
  private final ExpirySweeper sweeper;
  private final AtomicBoolean closed = new AtomicBoolean(false);

  public MemoryCacheBackend() {
    this(null, null, null);
  }

  /**
   * @param maxSize 최대 항목 수 (기본 10,000), 음수 불가
   * @param cleanupInterval 만료 항목 sweep 주기 (기본 60초), {@link Duration#ZERO}이면 sweeper 없음
   * @param clock 만료 판정용 시계 (기본 UTC 시스템 시계)
   */
  @Builder
  private MemoryCacheBackend(Integer maxSize, Duration cleanupInterval, Clock clock) {
    this.maxSize = maxSize == null ? DEFAULT_MAX_SIZE : maxSize;
    if (this.maxSize < 0) {
      throw new InvalidCacheArgumentException("maxSize=" + maxSize);
    }
    this.clock = clock == null ? Clock.systemUTC() : clock;
    Duration interval = cleanupInterval == null ? DEFAULT_CLEANUP_INTERVAL : cleanupInterval;
    this.sweeper =
        interval.isZero()
            ? null
            : ExpirySweeper.start("cache-forge-memory-sweeper", interval, this::sweepExpired);
    log.info("[MemoryCache] 초기화 (maxSize: {}, cleanupInterval: {})", this.maxSize, interval);
  }

  @Override
  public Optional<V> get(String key) {
    CacheKeys.requireValid(key);
    lock.lock();
    try {
      CacheEntry<Object> entry = liveEntry(key, clock.instant());
      if (entry == null) {
        return Optional.empty();
      }
      touch(key, entry);
      return Optional.of(cast(entry.value()));
    } finally {
      lock.unlock();
    }
  }

  @Override
  public boolean set(String key, V value, Duration ttl, boolean nx) {
    CacheKeys.requireValid(key);
    CacheKeys.requireValue(value);
    lock.lock();
    try {
      return write(key, value, ttl, nx, clock.instant());
    } finally {
      lock.unlock();
    }
  }

  @Override
  public boolean delete(String key) {
    CacheKeys.requireValid(key);
    lock.lock();
    try {
      return removeLive(key, clock.instant());
    } finally {
      lock.unlock();
    }
  }

  @Override
  public boolean exists(String key) {
    CacheKeys.requireValid(key);
    lock.lock();
    try {
      return liveEntry(key, clock.instant()) != null;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void clear() {
    lock.lock();
    try {
      int removed = entries.size();
      entries.clear();
      log.debug("[MemoryCache] 전체 삭제 ({}건)", removed);
    } finally {
      lock.unlock();
    }
  }

  @Override
  public Map<String, V> getMany(Collection<String> keys) {
    CacheKeys.requireValid(keys);
    lock.lock();
    try {
      Instant now = clock.instant();
      Map<String, V> found = new LinkedHashMap<>();
      for (String key : keys) {
        CacheEntry<Object> entry = liveEntry(key, now);
        if (entry != null) {
          touch(key, entry);
          found.put(key, cast(entry.value()));
        }
      }
      return found;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void setMany(Map<String, ? extends V> values, Duration ttl) {
    CacheKeys.requireEntries(values);
    lock.lock();
    try {
      Instant now = clock.instant();
      values.forEach((key, value) -> write(key, value, ttl, false, now));
    } finally {
      lock.unlock();
    }
  }

  @Override
  public int deleteMany(Collection<String> keys) {
    CacheKeys.requireValid(keys);
    lock.lock();
    try {
      Instant now = clock.instant();
      int removed = 0;
      for (String key : keys) {
        if (removeLive(key, now)) {
          removed++;
        }
      }
      return removed;
    } finally {
      lock.unlock();
    }
  }

  /** 매칭되는 live 키를 사전순으로 정렬한 뒤 오프셋 커서로 페이지를 자릅니다. */
  @Override
  public KeysPage keys(String pattern, long cursor, int count, Integer maxKeys) {
    GlobPattern glob = GlobPattern.compile(pattern);
    List<String> matches = new ArrayList<>();
    lock.lock();
    try {
      Instant now = clock.instant();
      entries.forEach(
          (key, entry) -> {
            if (!entry.isExpiredAt(now) && glob.matches(key)) {
              matches.add(key);
            }
          });
    } finally {
      lock.unlock();
    }
    matches.sort(null);
    return KeysPage.slice(matches, cursor, count, maxKeys);
  }

  @Override
  public long ttl(String key) {
    CacheKeys.requireValid(key);
    lock.lock();
    try {
      Instant now = clock.instant();
      CacheEntry<Object> entry = liveEntry(key, now);
      return entry == null ? TTL_ABSENT : entry.remainingSeconds(now);
    } finally {
      lock.unlock();
    }
  }

  @Override
  public long size() {
    lock.lock();
    try {
      return entries.size();
    } finally {
      lock.unlock();
    }
  }

  /** 용량 검사를 거치지 않고 센티널을 직접 넣고 뺍니다. 닫힌 엔진은 unhealthy입니다. */
  @Override
  public boolean checkHealth() {
    if (closed.get()) {
      return false;
    }
    lock.lock();
    try {
      Instant now = clock.instant();
      entries.put(HEALTH_CHECK_KEY, CacheEntry.of(HEALTH_MARKER, now, Duration.ofSeconds(1)));
      CacheEntry<Object> marker = entries.remove(HEALTH_CHECK_KEY);
      return marker != null && HEALTH_MARKER.equals(marker.value());
    } catch (RuntimeException e) {
      log.warn("[MemoryCache] 헬스 체크 실패: {}", e.getMessage());
      return false;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    if (sweeper != null) {
      sweeper.close();
    }
    log.info("[MemoryCache] 종료");
  }

  /** 만료된 항목을 모두 제거합니다. 백그라운드 sweeper가 주기적으로 호출합니다. */
  public int sweepExpired() {
    lock.lock();
    try {
      Instant now = clock.instant();
      int removed = 0;
      Iterator<CacheEntry<Object>> it = entries.values().iterator();
      while (it.hasNext()) {
        if (it.next().isExpiredAt(now)) {
          it.remove();
          removed++;
        }
      }
      return removed;
    } finally {
      lock.unlock();
    }
  }

  // ==================== lock 보유 상태에서만 호출 ====================

  private CacheEntry<Object> liveEntry(String key, Instant now) {
    CacheEntry<Object> entry = entries.get(key);
    if (entry == null) {
      return null;
    }
    if (entry.isExpiredAt(now)) {
      entries.remove(key);
      return null;
    }
    return entry;
  }

  private void touch(String key, CacheEntry<Object> entry) {
    entries.remove(key);
    entries.put(key, entry);
  }

  private boolean write(String key, Object value, Duration ttl, boolean nx, Instant now) {
    if (maxSize == 0) {
      return false;
    }
    CacheEntry<Object> existing = liveEntry(key, now);
    if (nx && existing != null) {
      return false;
    }
    if (existing != null) {
      entries.remove(key);
    } else if (entries.size() >= maxSize) {
      evictEldest();
    }
    entries.put(key, CacheEntry.of(value, now, ttl));
    return true;
  }

  private void evictEldest() {
    Iterator<String> it = entries.keySet().iterator();
    if (it.hasNext()) {
      String eldest = it.next();
      it.remove();
      log.debug("[MemoryCache] 용량 초과로 LRU 항목 제거: {}", eldest);
    }
  }

  private boolean removeLive(String key, Instant now) {
    CacheEntry<Object> entry = entries.remove(key);
    return entry != null && !entry.isExpiredAt(now);
  }

  @SuppressWarnings("unchecked")
  private V cast(Object value) {
    return (V) value;
  }
}
