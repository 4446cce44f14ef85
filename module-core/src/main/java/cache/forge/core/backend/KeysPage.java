package cache.forge.core.backend;

import cache.forge.error.exception.InvalidCacheArgumentException;
import java.util.List;

/**
 * {@link CacheBackend#keys} 한 페이지
 *
 * @param keys 이번 페이지의 키
 * @param cursor 다음 호출에 넘길 커서, 더 읽을 것이 없으면 {@code 0}
 * @param hasMore 다음 페이지 존재 여부
 * @param totalScanned 이번 호출에서 반환한 키 개수
 */
public record KeysPage(List<String> keys, long cursor, boolean hasMore, int totalScanned) {

  public KeysPage {
    keys = List.copyOf(keys);
  }

  public static KeysPage empty() {
    return new KeysPage(List.of(), 0L, false, 0);
  }

  /**
   * 정렬된 전체 매칭 키 목록에서 오프셋 커서로 한 페이지를 자릅니다.
   *
   * <p>로컬 엔진(메모리, SQLite)이 공유하는 페이지네이션 규칙입니다. 커서는 다음 페이지의 시작 오프셋입니다.
   */
  public static KeysPage slice(
      List<String> sortedMatches, long cursor, int count, Integer maxKeys) {
    int limit = pageLimit(count, maxKeys);
    if (cursor < 0) {
      throw new InvalidCacheArgumentException("cursor=" + cursor);
    }
    if (cursor >= sortedMatches.size()) {
      return empty();
    }
    int from = (int) cursor;
    int to = (int) Math.min(sortedMatches.size(), (long) from + limit);
    List<String> page = sortedMatches.subList(from, to);
    boolean hasMore = to < sortedMatches.size();
    return new KeysPage(page, hasMore ? to : 0L, hasMore, page.size());
  }

  /** count와 maxKeys 중 작은 값. 둘 다 양수여야 합니다. */
  public static int pageLimit(int count, Integer maxKeys) {
    if (count <= 0) {
      throw new InvalidCacheArgumentException("count=" + count);
    }
    if (maxKeys == null) {
      return count;
    }
    if (maxKeys <= 0) {
      throw new InvalidCacheArgumentException("maxKeys=" + maxKeys);
    }
    return Math.min(count, maxKeys);
  }
}
