package cache.forge.codec;

import cache.forge.error.exception.CacheSerializationException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.IOException;

/**
 * Jackson 기반 JSON 코덱
 *
 * <pre>{@code
 * CacheCodec<UserProfile> codec = JacksonCacheCodec.of(UserProfile.class);
 * CacheCodec<List<String>> tags = JacksonCacheCodec.of(new TypeReference<>() {});
 * }</pre>
 *
 * @param <V> 값 타입
 */
public class JacksonCacheCodec<V> implements CacheCodec<V> {

  private final ObjectMapper objectMapper;
  private final JavaType valueType;

  public JacksonCacheCodec(ObjectMapper objectMapper, JavaType valueType) {
    this.objectMapper = objectMapper;
    this.valueType = valueType;
  }

  public static <V> JacksonCacheCodec<V> of(Class<V> valueType) {
    ObjectMapper mapper = defaultObjectMapper();
    return new JacksonCacheCodec<>(mapper, mapper.constructType(valueType));
  }

  public static <V> JacksonCacheCodec<V> of(TypeReference<V> valueType) {
    ObjectMapper mapper = defaultObjectMapper();
    return new JacksonCacheCodec<>(mapper, mapper.constructType(valueType));
  }

  /** JavaTimeModule 등록, 날짜는 ISO-8601 문자열, 알 수 없는 필드는 무시 */
  public static ObjectMapper defaultObjectMapper() {
    return new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
  }

  @Override
  public byte[] serialize(V value) {
    try {
      return objectMapper.writeValueAsBytes(value);
    } catch (IOException e) {
      throw new CacheSerializationException("JSON 직렬화 실패: " + valueType, e);
    }
  }

  @Override
  public V deserialize(byte[] data) {
    try {
      return objectMapper.readValue(data, valueType);
    } catch (IOException e) {
      throw new CacheSerializationException("JSON 역직렬화 실패: " + valueType, e);
    }
  }
}
