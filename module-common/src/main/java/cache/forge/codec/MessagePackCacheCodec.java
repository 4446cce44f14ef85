package cache.forge.codec;

import cache.forge.error.exception.CacheSerializationException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.IOException;
import org.msgpack.core.MessagePackException;
import org.msgpack.jackson.dataformat.MessagePackFactory;

/**
 * MessagePack 바이너리 코덱
 *
 * <p>{@link JacksonCacheCodec}과 같은 매핑 규칙을 쓰고 출력만 MessagePack 형식입니다. JSON보다 작은 페이로드가 필요할 때 씁니다.
 *
 * <pre>{@code
 * CacheCodec<UserProfile> codec = MessagePackCacheCodec.of(UserProfile.class);
 * }</pre>
 *
 * @param <V> 값 타입
 */
public class MessagePackCacheCodec<V> implements CacheCodec<V> {

  private final ObjectMapper objectMapper;
  private final JavaType valueType;

  public MessagePackCacheCodec(ObjectMapper objectMapper, JavaType valueType) {
    this.objectMapper = objectMapper;
    this.valueType = valueType;
  }

  public static <V> MessagePackCacheCodec<V> of(Class<V> valueType) {
    ObjectMapper mapper = defaultObjectMapper();
    return new MessagePackCacheCodec<>(mapper, mapper.constructType(valueType));
  }

  public static <V> MessagePackCacheCodec<V> of(TypeReference<V> valueType) {
    ObjectMapper mapper = defaultObjectMapper();
    return new MessagePackCacheCodec<>(mapper, mapper.constructType(valueType));
  }

  public static ObjectMapper defaultObjectMapper() {
    return new ObjectMapper(new MessagePackFactory())
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
  }

  @Override
  public byte[] serialize(V value) {
    try {
      return objectMapper.writeValueAsBytes(value);
    } catch (IOException | MessagePackException e) {
      throw new CacheSerializationException("MessagePack 직렬화 실패: " + valueType, e);
    }
  }

  @Override
  public V deserialize(byte[] data) {
    try {
      return objectMapper.readValue(data, valueType);
    } catch (IOException | MessagePackException e) {
      throw new CacheSerializationException("MessagePack 역직렬화 실패: " + valueType, e);
    }
  }
}
