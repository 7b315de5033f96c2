package io.kneo.scheduler.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

@ConfigMapping(prefix = "scheduler")
public interface SchedulerConfig {
    @WithName("job-lock.stripes")
    @WithDefault("64")
    int getJobLockStripes();

    @WithName("plugin.table")
    @WithDefault("_plugins")
    String getPluginTable();
}
