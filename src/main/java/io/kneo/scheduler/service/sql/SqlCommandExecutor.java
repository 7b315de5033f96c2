package io.kneo.scheduler.service.sql;

import io.kneo.scheduler.model.cnst.CommandStyle;
import io.kneo.scheduler.model.job.SqlCommand;
import io.kneo.scheduler.service.exceptions.ProviderResolutionException;
import io.kneo.scheduler.service.sql.provider.DbCommand;
import io.kneo.scheduler.service.sql.provider.DbProvider;
import io.kneo.scheduler.service.sql.provider.DbProviderRegistry;
import io.kneo.scheduler.service.sql.provider.DbSession;
import io.kneo.scheduler.service.sql.provider.ProviderBinding;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.quartz.JobDataMap;
import org.quartz.JobExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;

/**
 * Runs one non-query command against the provider named in the job data. Every failure is
 * reported as a {@link JobExecutionException} that must not be refired immediately.
 */
@ApplicationScoped
public class SqlCommandExecutor {
    private static final Logger LOGGER = LoggerFactory.getLogger(SqlCommandExecutor.class);

    private final DbProviderRegistry providerRegistry;

    @Inject
    public SqlCommandExecutor(DbProviderRegistry providerRegistry) {
        this.providerRegistry = providerRegistry;
    }

    public void execute(JobDataMap data) throws JobExecutionException {
        SqlCommand command = readCommand(data);

        DbProvider provider;
        try {
            provider = providerRegistry.resolve(ProviderBinding.of(command));
        } catch (ProviderResolutionException e) {
            LOGGER.error("Error in SqlJob: unable to bind provider {}", command.providerAssemblyName(), e);
            throw new JobExecutionException(e.getMessage(), e, false);
        }

        int affected = execute(provider, command);
        LOGGER.info("SqlJob on provider {} affected {} row(s)", command.providerAssemblyName(), affected);
    }

    int execute(DbProvider provider, SqlCommand command) throws JobExecutionException {
        try (DbSession session = provider.open(command.connectionString());
             DbCommand dbCommand = session.prepare(command.nonQueryCommand(), command.commandStyle())) {
            return dbCommand.executeNonQuery();
        } catch (SQLException | RuntimeException e) {
            LOGGER.error("Error in SqlJob: ", e);
            throw new JobExecutionException(e.getMessage(), e, false);
        }
    }

    SqlCommand readCommand(JobDataMap data) throws JobExecutionException {
        String providerAssemblyName = getRequiredParameter(data, SqlCommand.PROVIDER_ASSEMBLY_NAME);
        String connectionClass = getRequiredParameter(data, SqlCommand.CONNECTION_CLASS);
        String commandClass = getRequiredParameter(data, SqlCommand.COMMAND_CLASS);
        String dataAdapterClass = getRequiredParameter(data, SqlCommand.DATA_ADAPTER_CLASS);
        String commandStyle = getOptionalParameter(data, SqlCommand.COMMAND_STYLE);

        String connectionString = getRequiredParameter(data, SqlCommand.CONNECTION_STRING);
        String nonQueryCommand = getRequiredParameter(data, SqlCommand.NON_QUERY_COMMAND);

        return new SqlCommand(connectionString, nonQueryCommand, providerAssemblyName, connectionClass,
                commandClass, dataAdapterClass, CommandStyle.of(commandStyle));
    }

    protected String getOptionalParameter(JobDataMap data, String propertyName) {
        Object value = data.get(propertyName);
        if (value == null || value.toString().isEmpty()) {
            return null;
        }
        return value.toString();
    }

    protected String getRequiredParameter(JobDataMap data, String propertyName) throws JobExecutionException {
        String value = getOptionalParameter(data, propertyName);
        if (value == null) {
            LOGGER.error("Error in SqlJob: {} not specified.", propertyName);
            throw new JobExecutionException(String.format("%s not specified.", propertyName), false);
        }
        return value;
    }
}
