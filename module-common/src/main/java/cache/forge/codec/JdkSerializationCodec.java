package cache.forge.codec;

import cache.forge.error.exception.CacheSerializationException;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.ObjectInputFilter;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;

/**
 * Java 직렬화 코덱
 *
 * <p>레지스트리로 생성한 백엔드의 기본 코덱입니다. 신뢰할 수 없는 저장소를 읽는다면 {@link ObjectInputFilter}를 지정해 역직렬화 대상 클래스를
 * 제한하세요.
 *
 * @param <V> 값 타입 ({@link java.io.Serializable} 구현 필요)
 */
public class JdkSerializationCodec<V> implements CacheCodec<V> {

  private final ObjectInputFilter inputFilter;

  public JdkSerializationCodec() {
    this(null);
  }

  public JdkSerializationCodec(ObjectInputFilter inputFilter) {
    this.inputFilter = inputFilter;
  }

  @Override
  public byte[] serialize(V value) {
    ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    try (ObjectOutputStream out = new ObjectOutputStream(buffer)) {
      out.writeObject(value);
    } catch (IOException e) {
      throw new CacheSerializationException("직렬화 실패: " + typeName(value), e);
    }
    return buffer.toByteArray();
  }

  @Override
  @SuppressWarnings("unchecked")
  public V deserialize(byte[] data) {
    try (ObjectInputStream in = new ObjectInputStream(new ByteArrayInputStream(data))) {
      if (inputFilter != null) {
        in.setObjectInputFilter(inputFilter);
      }
      return (V) in.readObject();
    } catch (IOException | ClassNotFoundException e) {
      throw new CacheSerializationException("역직렬화 실패: " + data.length + " bytes", e);
    }
  }

  private static String typeName(Object value) {
    return value == null ? "null" : value.getClass().getName();
  }
}
