package cache.forge.codec;

import cache.forge.error.exception.CacheSerializationException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/** UTF-8 문자열 코덱. 잘못된 UTF-8 시퀀스는 대체 문자로 바꾸지 않고 실패시킵니다. */
public final class StringCacheCodec implements CacheCodec<String> {

  public static final StringCacheCodec INSTANCE = new StringCacheCodec();

  private StringCacheCodec() {}

  @Override
  public byte[] serialize(String value) {
    return value.getBytes(StandardCharsets.UTF_8);
  }

  @Override
  public String deserialize(byte[] data) {
    try {
      return StandardCharsets.UTF_8
          .newDecoder()
          .onMalformedInput(CodingErrorAction.REPORT)
          .onUnmappableCharacter(CodingErrorAction.REPORT)
          .decode(ByteBuffer.wrap(data))
          .toString();
    } catch (CharacterCodingException e) {
      throw new CacheSerializationException("UTF-8 디코딩 실패", e);
    }
  }
}
