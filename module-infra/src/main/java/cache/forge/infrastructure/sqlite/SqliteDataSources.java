package cache.forge.infrastructure.sqlite;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import java.nio.file.Path;
import java.time.Duration;
import lombok.extern.slf4j.Slf4j;

/** SQLite 파일 전용 HikariCP 커넥션 풀 */
@Slf4j
final class SqliteDataSources {

  private SqliteDataSources() {}

  static HikariDataSource open(Path path, int poolSize, Duration busyTimeout) {
    HikariConfig config = new HikariConfig();

    config.setJdbcUrl("jdbc:sqlite:" + path.toAbsolutePath());
    config.setDriverClassName("org.sqlite.JDBC");

    // 드라이버 프로퍼티: 모든 커넥션이 같은 PRAGMA로 열린다
    config.addDataSourceProperty("journal_mode", "WAL");
    config.addDataSourceProperty("synchronous", "NORMAL");
    config.addDataSourceProperty("busy_timeout", String.valueOf(busyTimeout.toMillis()));
    // 쓰기 트랜잭션이 시작부터 RESERVED 락을 잡아야 NX 검사와 쓰기 사이에 다른 프로세스가 끼어들지 못한다
    config.addDataSourceProperty("transaction_mode", "IMMEDIATE");

    config.setMaximumPoolSize(poolSize);
    config.setMinimumIdle(1);
    config.setConnectionTimeout(Math.max(250L, busyTimeout.toMillis()));
    config.setPoolName("SqliteCachePool-" + path.getFileName());

    log.info("[SqliteCache] 커넥션 풀 생성 (path: {}, poolSize: {})", path, poolSize);
    return new HikariDataSource(config);
  }
}
