package io.kneo.scheduler.service.scheduler.quartz;

import io.kneo.scheduler.model.cnst.JobType;
import io.kneo.scheduler.model.job.PluginInvocation;
import io.kneo.scheduler.service.plugin.PluginRunner;
import io.kneo.scheduler.service.sql.SqlCommandExecutor;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.quartz.Job;
import org.quartz.JobDataMap;
import org.quartz.JobExecutionContext;
import org.quartz.JobExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The single job class every orchestrated job is bound to. The job type tag written at schedule
 * time selects the body that runs.
 */
@ApplicationScoped
public class DispatchingJob implements Job {
    private static final Logger LOGGER = LoggerFactory.getLogger(DispatchingJob.class);

    private final PluginRunner pluginRunner;
    private final SqlCommandExecutor sqlCommandExecutor;

    @Inject
    public DispatchingJob(PluginRunner pluginRunner, SqlCommandExecutor sqlCommandExecutor) {
        this.pluginRunner = pluginRunner;
        this.sqlCommandExecutor = sqlCommandExecutor;
    }

    @Override
    public void execute(JobExecutionContext context) throws JobExecutionException {
        JobDataMap data = context.getMergedJobDataMap();
        JobType jobType;
        try {
            jobType = JobType.resolve(data);
        } catch (IllegalArgumentException e) {
            LOGGER.error("Job {} carries no runnable body", context.getJobDetail().getKey(), e);
            throw new JobExecutionException(e.getMessage(), e, false);
        }

        LOGGER.info("Executing {} job {} fired by {}", jobType, context.getJobDetail().getKey(),
                context.getTrigger().getKey());
        switch (jobType) {
            case PLUGIN -> pluginRunner.run(new PluginInvocation(data.getString(PluginInvocation.PLUGIN_PATH)));
            case SQL -> sqlCommandExecutor.execute(data);
        }
    }
}
