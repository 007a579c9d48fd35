package cable.jdbc.store;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry for JDBC message stores with auto-detection support.
 *
 * <p>Stores are loaded via {@link ServiceLoader} from
 * {@code META-INF/services/cable.jdbc.store.AbstractJdbcMessageStore}. They use the default
 * table; call {@link AbstractJdbcMessageStore#withTableName} for another one.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * // Auto-detect from DataSource
 * AbstractJdbcMessageStore store = JdbcMessageStores.detect(dataSource);
 *
 * // Auto-detect from JDBC URL, custom table
 * AbstractJdbcMessageStore store = JdbcMessageStores.detect("jdbc:mysql://localhost/app")
 *     .withTableName("app_messages");
 *
 * // Get by name
 * AbstractJdbcMessageStore store = JdbcMessageStores.get("postgresql");
 * }</pre>
 */
public final class JdbcMessageStores {

  private static final List<AbstractJdbcMessageStore> STORES;
  private static final Map<String, AbstractJdbcMessageStore> BY_NAME = new ConcurrentHashMap<>();

  static {
    STORES = ServiceLoader.load(AbstractJdbcMessageStore.class)
        .stream()
        .map(ServiceLoader.Provider::get)
        .toList();

    for (AbstractJdbcMessageStore store : STORES) {
      BY_NAME.put(store.name().toLowerCase(), store);
    }
  }

  private JdbcMessageStores() {
  }

  /**
   * Returns all registered stores.
   */
  public static List<AbstractJdbcMessageStore> all() {
    return STORES;
  }

  /**
   * Gets a store by name.
   *
   * @param name store name (case-insensitive)
   * @return the store
   * @throws IllegalArgumentException if no store has that name
   */
  public static AbstractJdbcMessageStore get(String name) {
    AbstractJdbcMessageStore store = BY_NAME.get(name.toLowerCase());
    if (store == null) {
      throw new IllegalArgumentException("Unknown message store: " + name +
          ". Available: " + BY_NAME.keySet());
    }
    return store;
  }

  /**
   * Auto-detects the store from a DataSource's connection URL.
   *
   * @param dataSource the data source
   * @return detected store
   * @throws IllegalStateException if the URL cannot be read
   * @throws IllegalArgumentException if no store matches
   */
  public static AbstractJdbcMessageStore detect(DataSource dataSource) {
    String url;
    try (Connection conn = dataSource.getConnection()) {
      url = conn.getMetaData().getURL();
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to detect message store from DataSource", e);
    }
    return detect(url);
  }

  /**
   * Auto-detects the store from a JDBC URL.
   *
   * @param jdbcUrl the JDBC URL
   * @return detected store
   * @throws IllegalArgumentException if no store matches
   */
  public static AbstractJdbcMessageStore detect(String jdbcUrl) {
    if (jdbcUrl == null || jdbcUrl.isEmpty()) {
      throw new IllegalArgumentException("JDBC URL cannot be null or empty");
    }

    String lower = jdbcUrl.toLowerCase();
    for (AbstractJdbcMessageStore store : STORES) {
      for (String prefix : store.jdbcUrlPrefixes()) {
        if (lower.startsWith(prefix.toLowerCase())) {
          return store;
        }
      }
    }

    throw new IllegalArgumentException("No message store found for JDBC URL: " + jdbcUrl +
        ". Supported prefixes: " + allPrefixes());
  }

  private static List<String> allPrefixes() {
    return STORES.stream()
        .flatMap(s -> s.jdbcUrlPrefixes().stream())
        .toList();
  }
}
