package cache.forge.infrastructure.sqlite;

/**
 * {@code cache_entries} 스키마와 SQL
 *
 * <p>시각 컬럼은 모두 epoch 초(REAL)입니다. {@code expires_at}이 NULL이면 만료되지 않습니다.
 */
final class SqliteStatements {

  private SqliteStatements() {}

  static final String ENABLE_WAL = "PRAGMA journal_mode=WAL";

  static final String CREATE_TABLE =
      """
      CREATE TABLE IF NOT EXISTS cache_entries (
          key TEXT PRIMARY KEY,
          value BLOB NOT NULL,
          expires_at REAL,
          last_access REAL NOT NULL,
          created_at REAL NOT NULL
      )""";

  static final String CREATE_EXPIRES_INDEX =
      "CREATE INDEX IF NOT EXISTS idx_expires_at ON cache_entries(expires_at)"
          + " WHERE expires_at IS NOT NULL";

  static final String CREATE_LAST_ACCESS_INDEX =
      "CREATE INDEX IF NOT EXISTS idx_last_access ON cache_entries(last_access)";

  static final String SELECT_ENTRY = "SELECT value, expires_at FROM cache_entries WHERE key = ?";

  static final String SELECT_EXPIRES_AT = "SELECT expires_at FROM cache_entries WHERE key = ?";

  static final String TOUCH = "UPDATE cache_entries SET last_access = ? WHERE key = ?";

  static final String COUNT_LIVE_KEY =
      "SELECT COUNT(*) FROM cache_entries WHERE key = ? AND (expires_at IS NULL OR expires_at > ?)";

  static final String COUNT_KEY = "SELECT COUNT(*) FROM cache_entries WHERE key = ?";

  static final String COUNT_ALL = "SELECT COUNT(*) FROM cache_entries";

  // created_at은 최초 삽입 시에만 기록된다
  static final String UPSERT =
      """
      INSERT INTO cache_entries (key, value, expires_at, last_access, created_at)
      VALUES (?, ?, ?, ?, ?)
      ON CONFLICT(key) DO UPDATE SET
          value = excluded.value,
          expires_at = excluded.expires_at,
          last_access = excluded.last_access""";

  static final String EVICT_LRU =
      """
      DELETE FROM cache_entries WHERE key IN (
          SELECT key FROM cache_entries ORDER BY last_access ASC LIMIT ?
      )""";

  static final String DELETE_KEY = "DELETE FROM cache_entries WHERE key = ?";

  static final String DELETE_LIVE_KEY =
      "DELETE FROM cache_entries WHERE key = ? AND (expires_at IS NULL OR expires_at > ?)";

  static final String DELETE_EXPIRED_KEY =
      "DELETE FROM cache_entries WHERE key = ? AND expires_at IS NOT NULL AND expires_at <= ?";

  static final String DELETE_EXPIRED =
      "DELETE FROM cache_entries WHERE expires_at IS NOT NULL AND expires_at <= ?";

  static final String DELETE_ALL = "DELETE FROM cache_entries";

  static final String SELECT_LIVE_KEYS =
      "SELECT key FROM cache_entries WHERE expires_at IS NULL OR expires_at > ?";
}
