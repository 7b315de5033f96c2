package io.kneo.scheduler.model.job;

import io.kneo.scheduler.model.cnst.CommandStyle;
import io.kneo.scheduler.model.cnst.JobType;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A single non-query command against a database provider picked by name at fire time.
 */
public record SqlCommand(String connectionString,
                         String nonQueryCommand,
                         String providerAssemblyName,
                         String connectionClass,
                         String commandClass,
                         String dataAdapterClass,
                         CommandStyle commandStyle) implements JobBody {

    public static final String CONNECTION_STRING = "connectionString";
    public static final String NON_QUERY_COMMAND = "nonQueryCommand";
    public static final String PROVIDER_ASSEMBLY_NAME = "providerAssemblyName";
    public static final String CONNECTION_CLASS = "connectionClass";
    public static final String COMMAND_CLASS = "commandClass";
    public static final String DATA_ADAPTER_CLASS = "dataAdapterClass";
    public static final String COMMAND_STYLE = "commandStyle";

    public static final List<String> KEYS = List.of(CONNECTION_STRING, NON_QUERY_COMMAND, PROVIDER_ASSEMBLY_NAME,
            CONNECTION_CLASS, COMMAND_CLASS, DATA_ADAPTER_CLASS, COMMAND_STYLE);

    @Override
    public JobType type() {
        return JobType.SQL;
    }

    @Override
    public Map<String, Object> toDataMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put(CONNECTION_STRING, connectionString);
        map.put(NON_QUERY_COMMAND, nonQueryCommand);
        map.put(PROVIDER_ASSEMBLY_NAME, providerAssemblyName);
        map.put(CONNECTION_CLASS, connectionClass);
        map.put(COMMAND_CLASS, commandClass);
        map.put(DATA_ADAPTER_CLASS, dataAdapterClass);
        if (commandStyle == CommandStyle.STORED_PROCEDURE) {
            map.put(COMMAND_STYLE, "storedprocedure");
        }
        return map;
    }
}
