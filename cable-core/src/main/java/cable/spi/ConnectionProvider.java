package cable.spi;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Source of JDBC connections shared by the publisher, poller, sweeper and stats.
 *
 * <p>Every operation borrows its own connection and closes it when done, so the
 * implementation must tolerate concurrent callers (a pooled {@code DataSource} does).
 * If the provider also implements {@link AutoCloseable}, the bus closes it on shutdown.
 *
 * <p>{@code cable.jdbc.DataSourceConnectionProvider} adapts a {@code DataSource}.
 */
@FunctionalInterface
public interface ConnectionProvider {

    /**
     * Obtains a connection.
     *
     * @return an open connection; the caller must close it
     * @throws SQLException if a connection cannot be obtained
     */
    Connection getConnection() throws SQLException;
}
