package io.kneo.scheduler.service.sql.provider;

import java.sql.SQLException;

public interface DbCommand extends AutoCloseable {

    /**
     * @return affected row count as reported by the driver
     */
    int executeNonQuery() throws SQLException;

    @Override
    void close() throws SQLException;
}
