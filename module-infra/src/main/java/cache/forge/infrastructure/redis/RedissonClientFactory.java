package cache.forge.infrastructure.redis;

import cache.forge.error.exception.CacheConnectionException;
import java.time.Duration;
import lombok.extern.slf4j.Slf4j;
import org.redisson.Redisson;
import org.redisson.api.RedissonClient;
import org.redisson.config.Config;

/**
 * 단일 서버 Redisson 클라이언트 생성
 *
 * <p>{@link Redisson#create(Config)}는 생성 시점에 연결을 맺으므로 서버에 닿지 않으면 바로 실패합니다. 이 실패는 {@link
 * CacheConnectionException}으로 변환됩니다.
 */
@Slf4j
final class RedissonClientFactory {

  private static final int MIN_IDLE_CONNECTIONS = 4;

  private RedissonClientFactory() {}

  static RedissonClient create(
      String address,
      String password,
      int database,
      Duration connectTimeout,
      Duration timeout,
      int connectionPoolSize) {
    Config config = new Config();
    config
        .useSingleServer()
        .setAddress(address)
        .setPassword(password)
        .setDatabase(database)
        .setConnectTimeout(Math.toIntExact(connectTimeout.toMillis()))
        .setTimeout(Math.toIntExact(timeout.toMillis()))
        .setConnectionPoolSize(connectionPoolSize)
        .setConnectionMinimumIdleSize(Math.min(connectionPoolSize, MIN_IDLE_CONNECTIONS));
    try {
      RedissonClient client = Redisson.create(config);
      log.info("[RedisCache] Redisson 연결 완료 (address: {}, database: {})", address, database);
      return client;
    } catch (RuntimeException e) {
      throw new CacheConnectionException(address, e);
    }
  }
}
