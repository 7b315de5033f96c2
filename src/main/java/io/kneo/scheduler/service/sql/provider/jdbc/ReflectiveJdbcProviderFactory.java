package io.kneo.scheduler.service.sql.provider.jdbc;

import io.kneo.scheduler.service.exceptions.ProviderResolutionException;
import io.kneo.scheduler.service.sql.provider.DbProvider;
import io.kneo.scheduler.service.sql.provider.DbProviderFactory;
import io.kneo.scheduler.service.sql.provider.ProviderBinding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.Driver;
import java.sql.ResultSet;
import java.sql.Statement;

/**
 * Loads a JDBC driver by class name and resolves the connection, command and adapter classes
 * through the driver's own class loader.
 */
public class ReflectiveJdbcProviderFactory implements DbProviderFactory {
    private static final Logger LOGGER = LoggerFactory.getLogger(ReflectiveJdbcProviderFactory.class);
    public static final String NAME = "jdbc";

    private final ClassLoader classLoader;

    public ReflectiveJdbcProviderFactory() {
        this(null);
    }

    public ReflectiveJdbcProviderFactory(ClassLoader classLoader) {
        this.classLoader = classLoader;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public DbProvider create(ProviderBinding binding) {
        Class<? extends Driver> driverType = resolve(binding.providerName(), Driver.class, loader());
        Driver driver;
        try {
            driver = driverType.getDeclaredConstructor().newInstance();
        } catch (ReflectiveOperationException e) {
            throw new ProviderResolutionException("Unable to instantiate driver " + binding.providerName(), e);
        }

        ClassLoader providerLoader = driverType.getClassLoader() != null ? driverType.getClassLoader() : loader();
        return bind(driver,
                resolve(binding.connectionClass(), Connection.class, providerLoader),
                resolve(binding.commandClass(), Statement.class, providerLoader),
                resolve(binding.dataAdapterClass(), ResultSet.class, providerLoader));
    }

    private static <C extends Connection, S extends Statement, R extends ResultSet> DbProvider bind(
            Driver driver, Class<C> connectionType, Class<S> commandType, Class<R> adapterType) {
        LOGGER.debug("Bound {} with {}, {}, {}", driver.getClass().getName(), connectionType.getName(),
                commandType.getName(), adapterType.getName());
        return new JdbcProvider<>(driver, connectionType, commandType, adapterType);
    }

    static <T> Class<? extends T> resolve(String className, Class<T> expected, ClassLoader loader) {
        Class<?> type;
        try {
            type = Class.forName(className, false, loader);
        } catch (ClassNotFoundException | LinkageError e) {
            throw new ProviderResolutionException("Unable to load type " + className, e);
        }
        if (!expected.isAssignableFrom(type)) {
            throw new ProviderResolutionException(className + " is not a " + expected.getName());
        }
        return type.asSubclass(expected);
    }

    private ClassLoader loader() {
        if (classLoader != null) {
            return classLoader;
        }
        ClassLoader context = Thread.currentThread().getContextClassLoader();
        return context != null ? context : ReflectiveJdbcProviderFactory.class.getClassLoader();
    }
}
