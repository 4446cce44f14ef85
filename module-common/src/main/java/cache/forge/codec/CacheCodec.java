package cache.forge.codec;

import cache.forge.error.exception.CacheSerializationException;

/**
 * 캐시 값과 저장 바이트 사이의 변환 경계
 *
 * <p>영속/원격 엔진은 바이트만 저장하므로 생성 시점에 코덱을 주입받습니다. 구현체는 실패를 반드시 {@link
 * CacheSerializationException}으로 알려야 하며, 미스({@code null})로 바꾸면 안 됩니다.
 *
 * @param <V> 값 타입
 */
public interface CacheCodec<V> {

  /**
   * @throws CacheSerializationException 값을 직렬화할 수 없을 때
   */
  byte[] serialize(V value);

  /**
   * @throws CacheSerializationException 저장된 바이트가 손상되었거나 타입이 맞지 않을 때
   */
  V deserialize(byte[] data);
}
