package cache.forge.infrastructure.config;

import cache.forge.core.registry.CacheBackendRegistry;
import cache.forge.infrastructure.executor.DefaultLogicExecutor;
import cache.forge.infrastructure.executor.LogicExecutor;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Metrics;
import org.redisson.api.RedissonClient;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * cache-forge 자동 구성
 *
 * <ul>
 *   <li>{@link LogicExecutor}: MeterRegistry 빈이 있으면 사용, 없으면 전역 레지스트리
 *   <li>{@link CacheBackendRegistry}: 내장 백엔드 등록, {@code cache-forge.registry.enabled=false}로 끔
 *   <li>{@link RedissonClient} 빈이 있으면 {@code redis} 백엔드가 공유
 * </ul>
 */
@AutoConfiguration
@EnableConfigurationProperties(CacheForgeProperties.class)
public class CacheForgeAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public LogicExecutor cacheForgeLogicExecutor(ObjectProvider<MeterRegistry> meterRegistry) {
    return new DefaultLogicExecutor(meterRegistry.getIfAvailable(() -> Metrics.globalRegistry));
  }

  @Bean
  @ConditionalOnMissingBean
  @ConditionalOnProperty(
      prefix = "cache-forge.registry",
      name = "enabled",
      havingValue = "true",
      matchIfMissing = true)
  public CacheBackendRegistry cacheBackendRegistry(
      LogicExecutor executor,
      CacheForgeProperties properties,
      ObjectProvider<RedissonClient> redissonClient) {
    CacheBackendRegistry registry = new CacheBackendRegistry();
    BuiltInBackends.registerAll(registry, executor, properties, redissonClient.getIfAvailable());
    return registry;
  }
}
