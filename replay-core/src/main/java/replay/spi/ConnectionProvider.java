package replay.spi;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Shared source of target-database connections: the base handle every pooled
 * connection is obtained from and returned to.
 *
 * <p>Implementations must tolerate concurrent {@link #getConnection()} and
 * {@link #forceClose(Connection)} calls from all workers recovering at the same time.
 *
 * @see replay.jdbc.DataSourceConnectionProvider
 */
public interface ConnectionProvider extends AutoCloseable {

    /**
     * Obtains a new JDBC connection.
     *
     * @return an open connection; the caller owns it until it is force-closed
     * @throws SQLException if a connection cannot be obtained
     */
    Connection getConnection() throws SQLException;

    /**
     * Discards a connection that is presumed broken so it is never handed out again.
     *
     * @param connection the connection to discard
     * @throws SQLException if the connection could not be closed
     */
    default void forceClose(Connection connection) throws SQLException {
        connection.close();
    }

    /**
     * Releases the provider. Connections obtained earlier must not be used afterwards.
     *
     * @throws SQLException if the underlying source failed to close
     */
    @Override
    void close() throws SQLException;
}
