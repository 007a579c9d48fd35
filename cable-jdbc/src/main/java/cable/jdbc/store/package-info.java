/**
 * JDBC-based {@link cable.spi.MessageStore} implementations.
 *
 * <p>{@link cable.jdbc.store.AbstractJdbcMessageStore} provides shared SQL and row mapping;
 * subclasses supply the DDL and database-specific queries: H2, MySQL
 * ({@code DELETE...ORDER BY...LIMIT}) and PostgreSQL.
 *
 * @see cable.jdbc.store.AbstractJdbcMessageStore
 * @see cable.jdbc.store.H2MessageStore
 * @see cable.jdbc.store.MySqlMessageStore
 * @see cable.jdbc.store.PostgresMessageStore
 * @see cable.jdbc.store.JdbcMessageStores
 */
package cable.jdbc.store;
