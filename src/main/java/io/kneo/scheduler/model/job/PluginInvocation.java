package io.kneo.scheduler.model.job;

import io.kneo.scheduler.model.cnst.JobType;

import java.util.LinkedHashMap;
import java.util.Map;

public record PluginInvocation(String pluginPath) implements JobBody {
    public static final String PLUGIN_PATH = "pluginPath";

    @Override
    public JobType type() {
        return JobType.PLUGIN;
    }

    @Override
    public Map<String, Object> toDataMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put(PLUGIN_PATH, pluginPath);
        return map;
    }
}
