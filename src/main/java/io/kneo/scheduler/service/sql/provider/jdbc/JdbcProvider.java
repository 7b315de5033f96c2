package io.kneo.scheduler.service.sql.provider.jdbc;

import io.kneo.scheduler.service.exceptions.ProviderResolutionException;
import io.kneo.scheduler.service.sql.provider.DbProvider;

import java.sql.Connection;
import java.sql.Driver;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Properties;

public class JdbcProvider<C extends Connection, S extends Statement, R extends ResultSet> implements DbProvider {
    private final Driver driver;
    private final Class<C> connectionType;
    private final Class<S> commandType;
    private final Class<R> adapterType;

    public JdbcProvider(Driver driver, Class<C> connectionType, Class<S> commandType, Class<R> adapterType) {
        this.driver = driver;
        this.connectionType = connectionType;
        this.commandType = commandType;
        this.adapterType = adapterType;
    }

    @Override
    public JdbcControl<C, S, R> open(String connectionString) throws SQLException {
        Connection connection = driver.connect(connectionString, new Properties());
        if (connection == null) {
            throw new SQLException("Driver " + driver.getClass().getName() + " does not accept the connection string");
        }
        if (!connectionType.isInstance(connection)) {
            String actual = connection.getClass().getName();
            connection.close();
            throw new ProviderResolutionException("Driver returned " + actual + ", expected " + connectionType.getName());
        }
        return new JdbcControl<>(connectionType.cast(connection), commandType, adapterType);
    }
}
