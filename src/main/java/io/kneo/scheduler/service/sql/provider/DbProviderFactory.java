package io.kneo.scheduler.service.sql.provider;

/**
 * Builds providers for one provider name. CDI beans implementing this interface are registered
 * with {@link DbProviderRegistry} at startup.
 */
public interface DbProviderFactory {

    String name();

    DbProvider create(ProviderBinding binding);
}
