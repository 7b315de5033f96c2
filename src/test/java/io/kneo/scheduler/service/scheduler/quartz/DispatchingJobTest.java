package io.kneo.scheduler.service.scheduler.quartz;

import io.kneo.scheduler.model.cnst.JobType;
import io.kneo.scheduler.model.job.PluginInvocation;
import io.kneo.scheduler.model.job.SqlCommand;
import io.kneo.scheduler.service.plugin.PluginRunner;
import io.kneo.scheduler.service.sql.SqlCommandExecutor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.quartz.JobDataMap;
import org.quartz.JobDetail;
import org.quartz.JobExecutionContext;
import org.quartz.JobExecutionException;
import org.quartz.JobKey;
import org.quartz.Trigger;
import org.quartz.TriggerKey;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class DispatchingJobTest {

    @Mock
    private PluginRunner pluginRunner;

    @Mock
    private SqlCommandExecutor sqlCommandExecutor;

    private DispatchingJob job;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        job = new DispatchingJob(pluginRunner, sqlCommandExecutor);
    }

    @Test
    void pluginTagRunsPlugin() throws Exception {
        JobDataMap data = new JobDataMap();
        data.put(JobType.DATA_KEY, JobType.PLUGIN.name());
        data.put(PluginInvocation.PLUGIN_PATH, "/opt/p.jar");

        job.execute(context(data));

        verify(pluginRunner).run(new PluginInvocation("/opt/p.jar"));
        verifyNoInteractions(sqlCommandExecutor);
    }

    @Test
    void sqlTagRunsCommandWithTheMergedData() throws Exception {
        JobDataMap data = new JobDataMap();
        data.put(JobType.DATA_KEY, JobType.SQL.name());
        data.put(SqlCommand.NON_QUERY_COMMAND, "DELETE FROM audit");

        job.execute(context(data));

        verify(sqlCommandExecutor).execute(data);
        verify(pluginRunner, never()).run(any());
    }

    @Test
    void untaggedJobIsInferredFromKeys() throws Exception {
        JobDataMap data = new JobDataMap();
        data.put(PluginInvocation.PLUGIN_PATH, "/opt/p.jar");

        job.execute(context(data));

        verify(pluginRunner).run(new PluginInvocation("/opt/p.jar"));
    }

    @Test
    void jobWithoutBodyFailsWithoutRefire() {
        JobDataMap data = new JobDataMap();
        data.put("something", "else");

        JobExecutionException e = assertThrows(JobExecutionException.class, () -> job.execute(context(data)));

        assertFalse(e.refireImmediately());
        verifyNoInteractions(pluginRunner, sqlCommandExecutor);
    }

    @Test
    void bodyFailurePropagates() throws Exception {
        JobDataMap data = new JobDataMap();
        data.put(PluginInvocation.PLUGIN_PATH, "/opt/p.jar");
        doThrow(new JobExecutionException("boom", false)).when(pluginRunner).run(any());

        assertThrows(JobExecutionException.class, () -> job.execute(context(data)));
    }

    private static JobExecutionContext context(JobDataMap data) {
        JobExecutionContext context = mock(JobExecutionContext.class);
        JobDetail detail = mock(JobDetail.class);
        Trigger trigger = mock(Trigger.class);
        when(detail.getKey()).thenReturn(new JobKey("J", "G"));
        when(trigger.getKey()).thenReturn(new TriggerKey("T", "G"));
        when(context.getMergedJobDataMap()).thenReturn(data);
        when(context.getJobDetail()).thenReturn(detail);
        when(context.getTrigger()).thenReturn(trigger);
        return context;
    }
}
