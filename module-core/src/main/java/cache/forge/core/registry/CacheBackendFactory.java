package cache.forge.core.registry;

import cache.forge.core.backend.CacheBackend;

/** 이름으로 등록되는 백엔드 생성 함수 */
@FunctionalInterface
public interface CacheBackendFactory {

  CacheBackend<Object> create(BackendOptions options);
}
