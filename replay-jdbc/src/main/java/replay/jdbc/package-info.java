/**
 * JDBC implementation of the replay layer: the worker {@link replay.jdbc.ConnectionPool},
 * its {@link replay.jdbc.DbConnection}s and the HikariCP-backed connection source.
 */
package replay.jdbc;
