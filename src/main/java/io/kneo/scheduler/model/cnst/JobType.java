package io.kneo.scheduler.model.cnst;

import io.kneo.scheduler.model.job.PluginInvocation;
import io.kneo.scheduler.model.job.SqlCommand;

import java.util.Map;

public enum JobType {
    PLUGIN, SQL;

    public static final String DATA_KEY = "jobType";

    /**
     * Decides which body a job data map describes. An explicit {@value #DATA_KEY} entry wins,
     * otherwise the variant is inferred from the keys present.
     *
     * @throws IllegalArgumentException when the map matches no variant
     */
    public static JobType resolve(Map<String, ?> dataMap) {
        if (dataMap == null || dataMap.isEmpty()) {
            throw new IllegalArgumentException("Job data map is empty, unable to resolve job type");
        }
        Object explicit = dataMap.get(DATA_KEY);
        if (explicit != null) {
            try {
                return JobType.valueOf(explicit.toString().trim().toUpperCase());
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unknown job type: " + explicit, e);
            }
        }
        if (dataMap.containsKey(PluginInvocation.PLUGIN_PATH)) {
            return PLUGIN;
        }
        for (String key : SqlCommand.KEYS) {
            if (dataMap.containsKey(key)) {
                return SQL;
            }
        }
        throw new IllegalArgumentException("Unable to resolve job type from data map keys " + dataMap.keySet());
    }
}
