package io.kneo.scheduler.service.sql.provider;

import io.kneo.scheduler.model.cnst.CommandStyle;

import java.sql.SQLException;

public interface DbSession extends AutoCloseable {

    DbCommand prepare(String commandText, CommandStyle style) throws SQLException;

    @Override
    void close() throws SQLException;
}
