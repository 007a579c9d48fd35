package cable.jdbc;

import cable.spi.ConnectionProvider;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;

/**
 * {@link ConnectionProvider} backed by a {@link DataSource}.
 *
 * <p>Closing the provider closes the data source when it is itself {@link AutoCloseable}
 * (a HikariCP pool, for example). Pass {@code closeDataSource=false} when the data source
 * is owned elsewhere, such as a Spring-managed bean.
 *
 * @see ConnectionProvider
 */
public final class DataSourceConnectionProvider implements ConnectionProvider, AutoCloseable {
  private final DataSource dataSource;
  private final boolean closeDataSource;

  public DataSourceConnectionProvider(DataSource dataSource) {
    this(dataSource, true);
  }

  public DataSourceConnectionProvider(DataSource dataSource, boolean closeDataSource) {
    this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
    this.closeDataSource = closeDataSource;
  }

  public DataSource dataSource() {
    return dataSource;
  }

  @Override
  public Connection getConnection() throws SQLException {
    return dataSource.getConnection();
  }

  @Override
  public void close() throws Exception {
    if (closeDataSource && dataSource instanceof AutoCloseable closeable) {
      closeable.close();
    }
  }
}
