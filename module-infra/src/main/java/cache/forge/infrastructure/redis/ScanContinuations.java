package cache.forge.infrastructure.redis;

import cache.forge.error.exception.InvalidCacheArgumentException;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * SCAN 이어받기 테이블
 *
 * <p>SCAN 한 번이 페이지 한도보다 많은 키를 돌려주면 남은 키와 Redis 커서를 토큰에 묶어 보관합니다. 호출자는 Redis 커서 대신 이 토큰을 다음
 * 커서로 받으므로 한도를 넘긴 키도 다음 페이지에서 빠짐없이 나옵니다.
 *
 * <p>토큰은 1부터 증가하며 일정 시간 뒤 만료됩니다. 같은 토큰으로 재시도해도 같은 위치에서 이어집니다. 토큰은 발급 당시 패턴에 묶이며 다른
 * 패턴으로 이어받을 수 없습니다.
 */
final class ScanContinuations {

  static final long MAX_OPEN_SCANS = 10_000L;

  private final Cache<Long, Position> positions;
  private final AtomicLong sequence = new AtomicLong();

  ScanContinuations(Duration ttl) {
    this.positions =
        Caffeine.newBuilder().expireAfterWrite(ttl).maximumSize(MAX_OPEN_SCANS).build();
  }

  /** 커서 0은 새 SCAN, 그 외는 같은 패턴으로 저장된 위치 */
  Position resume(long cursor, String pattern) {
    if (cursor == 0L) {
      return Position.start(pattern);
    }
    Position position = positions.getIfPresent(cursor);
    if (position == null) {
      throw new InvalidCacheArgumentException("unknown or expired cursor: " + cursor);
    }
    if (!position.pattern().equals(pattern)) {
      throw new InvalidCacheArgumentException(
          "cursor " + cursor + " belongs to pattern '" + position.pattern() + "'");
    }
    return position;
  }

  long save(Position position) {
    long token = sequence.incrementAndGet();
    positions.put(token, position);
    return token;
  }

  long openScans() {
    positions.cleanUp();
    return positions.estimatedSize();
  }

  /**
   * @param pattern 이 SCAN을 시작한 호출자 패턴 (prefix 제외)
   * @param redisCursor 다음 SCAN에 넘길 Redis 커서
   * @param pending 이미 받았지만 아직 돌려주지 않은 키 (prefix 제거됨)
   * @param started SCAN을 한 번이라도 호출했는지 여부
   */
  record Position(String pattern, String redisCursor, List<String> pending, boolean started) {

    static Position start(String pattern) {
      return new Position(pattern, "0", List.of(), false);
    }

    boolean exhausted() {
      return started && "0".equals(redisCursor);
    }
  }
}
