package io.kneo.scheduler.service.sql.provider;

import io.kneo.scheduler.service.sql.provider.jdbc.ReflectiveJdbcProviderFactory;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Any;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Provider name to factory table. Names without a registered factory fall back to reflective
 * JDBC binding, where the provider name is a driver class.
 */
@ApplicationScoped
public class DbProviderRegistry {
    private static final Logger LOGGER = LoggerFactory.getLogger(DbProviderRegistry.class);

    private final Map<String, DbProviderFactory> factories = new ConcurrentHashMap<>();
    private final DbProviderFactory fallback;

    @Inject
    public DbProviderRegistry(@Any Instance<DbProviderFactory> registered) {
        this(registered.stream().toList(), new ReflectiveJdbcProviderFactory());
    }

    public DbProviderRegistry(Collection<DbProviderFactory> registered, DbProviderFactory fallback) {
        this.fallback = fallback;
        registered.forEach(this::register);
    }

    public void register(DbProviderFactory factory) {
        DbProviderFactory previous = factories.put(factory.name(), factory);
        if (previous != null && previous != factory) {
            LOGGER.warn("Provider {} re-registered, {} replaces {}", factory.name(),
                    factory.getClass().getName(), previous.getClass().getName());
        } else {
            LOGGER.info("Registered database provider {}", factory.name());
        }
    }

    public boolean isRegistered(String providerName) {
        return factories.containsKey(providerName);
    }

    public DbProvider resolve(ProviderBinding binding) {
        DbProviderFactory factory = factories.get(binding.providerName());
        if (factory == null) {
            LOGGER.debug("No registered provider {}, binding reflectively", binding.providerName());
            factory = fallback;
        }
        return factory.create(binding);
    }
}
