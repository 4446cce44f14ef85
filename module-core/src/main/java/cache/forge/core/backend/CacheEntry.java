package cache.forge.core.backend;

import java.time.Duration;
import java.time.Instant;

/**
 * 저장된 한 항목
 *
 * @param value 값 (메모리 엔진은 객체, 영속 엔진은 인코딩된 바이트)
 * @param expiresAt 절대 만료 시각, {@code null}이면 만료 없음
 */
public record CacheEntry<T>(T value, Instant expiresAt) {

  public static <T> CacheEntry<T> of(T value, Instant now, Duration ttl) {
    return new CacheEntry<>(value, expiresAt(now, ttl));
  }

  /** {@code now >= expiresAt}이면 만료입니다. */
  public boolean isExpiredAt(Instant now) {
    return expiresAt != null && !now.isBefore(expiresAt);
  }

  /** 남은 초 (올림), 만료 없음이면 {@link CacheBackend#TTL_NO_EXPIRY} */
  public long remainingSeconds(Instant now) {
    if (expiresAt == null) {
      return CacheBackend.TTL_NO_EXPIRY;
    }
    Duration remaining = Duration.between(now, expiresAt);
    if (remaining.isNegative()) {
      return 0L;
    }
    return remaining.getSeconds() + (remaining.getNano() > 0 ? 1L : 0L);
  }

  /**
   * {@code now + ttl}. {@link Instant} 범위를 넘는 TTL은 {@link Instant#MAX}(양수) 또는 {@link
   * Instant#MIN}(음수)으로 포화됩니다.
   */
  public static Instant expiresAt(Instant now, Duration ttl) {
    if (ttl == null) {
      return null;
    }
    if (ttl.compareTo(Duration.between(now, Instant.MAX)) >= 0) {
      return Instant.MAX;
    }
    if (ttl.compareTo(Duration.between(now, Instant.MIN)) <= 0) {
      return Instant.MIN;
    }
    return now.plus(ttl);
  }

  /** 밀리초를 초 단위로 올림합니다. 음수는 0입니다. */
  public static long ceilSeconds(long millis) {
    if (millis <= 0L) {
      return 0L;
    }
    return millis / 1000L + (millis % 1000L == 0L ? 0L : 1L);
  }
}
