/**
 * JDBC plumbing shared by the message stores: connection provider, SQL helper and table
 * name validation.
 *
 * @see cable.jdbc.DataSourceConnectionProvider
 */
package cable.jdbc;
