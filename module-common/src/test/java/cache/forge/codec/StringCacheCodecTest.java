package cache.forge.codec;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import cache.forge.error.exception.CacheSerializationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("StringCacheCodec 단위 테스트")
class StringCacheCodecTest {

  @Test
  @DisplayName("멀티바이트 문자열을 UTF-8로 보존한다")
  void multiByte() {
    byte[] bytes = StringCacheCodec.INSTANCE.serialize("캐시 ✓");

    assertThat(bytes).hasSize(10);
    assertThat(StringCacheCodec.INSTANCE.deserialize(bytes)).isEqualTo("캐시 ✓");
  }

  @Test
  @DisplayName("잘못된 UTF-8 시퀀스는 대체 문자 대신 예외를 던진다")
  void malformed() {
    assertThatThrownBy(() -> StringCacheCodec.INSTANCE.deserialize(new byte[] {(byte) 0xC3}))
        .isInstanceOf(CacheSerializationException.class);
  }
}
