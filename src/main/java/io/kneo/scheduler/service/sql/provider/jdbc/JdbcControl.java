package io.kneo.scheduler.service.sql.provider.jdbc;

import io.kneo.scheduler.model.cnst.CommandStyle;
import io.kneo.scheduler.service.exceptions.ProviderResolutionException;
import io.kneo.scheduler.service.sql.provider.DbCommand;
import io.kneo.scheduler.service.sql.provider.DbSession;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * One open connection of type {@code C}. Commands it prepares must be of type {@code S};
 * result sets of type {@code R} are what queries on this provider would yield.
 */
public class JdbcControl<C extends Connection, S extends Statement, R extends ResultSet> implements DbSession {
    private final C connection;
    private final Class<S> commandType;
    private final Class<R> adapterType;

    JdbcControl(C connection, Class<S> commandType, Class<R> adapterType) {
        this.connection = connection;
        this.commandType = commandType;
        this.adapterType = adapterType;
    }

    public C getConnection() {
        return connection;
    }

    public Class<R> getAdapterType() {
        return adapterType;
    }

    @Override
    public DbCommand prepare(String commandText, CommandStyle style) throws SQLException {
        PreparedStatement statement = style == CommandStyle.STORED_PROCEDURE
                ? connection.prepareCall(toCallSyntax(commandText))
                : connection.prepareStatement(commandText);
        if (!commandType.isInstance(statement)) {
            String actual = statement.getClass().getName();
            statement.close();
            throw new ProviderResolutionException("Driver prepared " + actual + ", expected " + commandType.getName());
        }
        return new JdbcCommand(statement);
    }

    @Override
    public void close() throws SQLException {
        connection.close();
    }

    static String toCallSyntax(String procedure) {
        String trimmed = procedure.trim();
        if (trimmed.startsWith("{")) {
            return trimmed;
        }
        return "{call " + trimmed + "}";
    }

    private static final class JdbcCommand implements DbCommand {
        private final PreparedStatement statement;

        private JdbcCommand(PreparedStatement statement) {
            this.statement = statement;
        }

        @Override
        public int executeNonQuery() throws SQLException {
            return statement.executeUpdate();
        }

        @Override
        public void close() throws SQLException {
            statement.close();
        }
    }
}
