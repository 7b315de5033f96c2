package io.kneo.scheduler.service.sql.provider;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DbProviderRegistryTest {

    @Test
    void registeredNameWins() {
        DbProvider provider = mock(DbProvider.class);
        DbProviderFactory named = factory("oracle", provider);
        DbProviderFactory fallback = mock(DbProviderFactory.class);
        DbProviderRegistry registry = new DbProviderRegistry(List.of(named), fallback);

        assertTrue(registry.isRegistered("oracle"));
        assertSame(provider, registry.resolve(new ProviderBinding("oracle", "c", "s", "r")));
        verify(fallback, never()).create(any());
    }

    @Test
    void unknownNameFallsBack() {
        DbProvider provider = mock(DbProvider.class);
        DbProviderFactory fallback = factory("jdbc", provider);
        DbProviderRegistry registry = new DbProviderRegistry(List.of(), fallback);

        assertFalse(registry.isRegistered("org.h2.Driver"));
        assertSame(provider, registry.resolve(new ProviderBinding("org.h2.Driver", "c", "s", "r")));
    }

    @Test
    void laterRegistrationReplacesEarlier() {
        DbProvider second = mock(DbProvider.class);
        DbProviderRegistry registry = new DbProviderRegistry(List.of(factory("oracle", mock(DbProvider.class))),
                mock(DbProviderFactory.class));

        registry.register(factory("oracle", second));

        assertSame(second, registry.resolve(new ProviderBinding("oracle", "c", "s", "r")));
    }

    private static DbProviderFactory factory(String name, DbProvider provider) {
        DbProviderFactory factory = mock(DbProviderFactory.class);
        when(factory.name()).thenReturn(name);
        when(factory.create(any())).thenReturn(provider);
        return factory;
    }
}
