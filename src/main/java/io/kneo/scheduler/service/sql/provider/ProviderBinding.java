package io.kneo.scheduler.service.sql.provider;

import io.kneo.scheduler.model.job.SqlCommand;

public record ProviderBinding(String providerName, String connectionClass, String commandClass, String dataAdapterClass) {

    public static ProviderBinding of(SqlCommand command) {
        return new ProviderBinding(command.providerAssemblyName(), command.connectionClass(),
                command.commandClass(), command.dataAdapterClass());
    }
}
