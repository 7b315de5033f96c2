package io.kneo.scheduler.service;

import io.kneo.scheduler.dto.PluginCronTriggerDTO;
import io.kneo.scheduler.dto.PluginSimpleTriggerDTO;
import io.kneo.scheduler.model.Plugin;
import io.kneo.scheduler.model.cnst.PluginStatus;
import io.kneo.scheduler.model.job.PluginInvocation;
import io.kneo.scheduler.model.trigger.CronTriggerDescriptor;
import io.kneo.scheduler.model.trigger.SimpleTriggerDescriptor;
import io.kneo.scheduler.model.trigger.TriggerDescriptor;
import io.kneo.scheduler.repository.PluginStore;
import io.kneo.scheduler.service.exceptions.PluginNotFoundException;
import io.kneo.scheduler.service.scheduler.SchedulerCore;
import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class PluginTriggerServiceTest {

    @Mock
    private PluginStore pluginStore;

    @Mock
    private SchedulerCore schedulerCore;

    private PluginTriggerService service;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        service = new PluginTriggerService(pluginStore, schedulerCore);
    }

    @Test
    void unregisteredPluginIsAHardNotFound() {
        when(pluginStore.findByName("ghost")).thenReturn(Uni.createFrom().nullItem());
        PluginSimpleTriggerDTO dto = new PluginSimpleTriggerDTO();
        dto.setPluginName("ghost");

        PluginNotFoundException e = assertThrows(PluginNotFoundException.class,
                () -> service.scheduleSimpleTrigger(dto).await().indefinitely());

        assertEquals("ghost", e.getPluginName());
        verifyNoInteractions(schedulerCore);
    }

    @Test
    void simpleTriggerLandsInThePluginGroup() throws Exception {
        when(pluginStore.findByName("report"))
                .thenReturn(Uni.createFrom().item(new Plugin("report", "/opt/plugins/report.jar", PluginStatus.REGISTERED)));
        Instant start = Instant.parse("2024-06-01T06:00:00Z");
        PluginSimpleTriggerDTO dto = new PluginSimpleTriggerDTO();
        dto.setPluginName("report");
        dto.setTriggerName("hourly");
        dto.setRepeatCount(-1);
        dto.setRepeatInterval(Duration.ofHours(1));
        dto.setStartDateTime(start);

        service.scheduleSimpleTrigger(dto).await().indefinitely();

        ArgumentCaptor<TriggerDescriptor> captor = ArgumentCaptor.forClass(TriggerDescriptor.class);
        verify(schedulerCore).scheduleTrigger(captor.capture());
        SimpleTriggerDescriptor descriptor = assertInstanceOf(SimpleTriggerDescriptor.class, captor.getValue());
        assertEquals("hourly", descriptor.getName());
        assertEquals("report", descriptor.getGroup());
        assertEquals("Job_report", descriptor.getJobName());
        assertEquals("report", descriptor.getJobGroup());
        assertEquals(-1, descriptor.getRepeatCount());
        assertEquals(Duration.ofHours(1), descriptor.getRepeatInterval());
        assertEquals(start, descriptor.getStartDateTime());
        assertEquals(Map.of(PluginInvocation.PLUGIN_PATH, "/opt/plugins/report.jar"), descriptor.getDataMap());
    }

    @Test
    void cronTriggerCarriesExpression() throws Exception {
        when(pluginStore.findByName("report"))
                .thenReturn(Uni.createFrom().item(new Plugin("report", "/opt/plugins/report.jar", PluginStatus.REGISTERED)));
        PluginCronTriggerDTO dto = new PluginCronTriggerDTO();
        dto.setPluginName("report");
        dto.setTriggerName("nightly");
        dto.setCronExpression("0 0 2 * * ?");

        service.scheduleCronTrigger(dto).await().indefinitely();

        ArgumentCaptor<TriggerDescriptor> captor = ArgumentCaptor.forClass(TriggerDescriptor.class);
        verify(schedulerCore).scheduleTrigger(captor.capture());
        CronTriggerDescriptor descriptor = assertInstanceOf(CronTriggerDescriptor.class, captor.getValue());
        assertEquals("0 0 2 * * ?", descriptor.getCronExpression());
        assertEquals("Job_report", descriptor.getJobName());
    }

    @Test
    void removeTriggerUsesPluginAsGroup() throws Exception {
        service.removeTrigger("report", "hourly").await().indefinitely();

        verify(schedulerCore).removeTrigger("hourly", "report");
    }

    @Test
    void engineFailureSurfaces() throws Exception {
        when(pluginStore.findByName("report"))
                .thenReturn(Uni.createFrom().item(new Plugin("report", "/opt/plugins/report.jar", PluginStatus.REGISTERED)));
        doThrow(new IllegalArgumentException("Invalid cron expression: x"))
                .when(schedulerCore).scheduleTrigger(any());
        PluginCronTriggerDTO dto = new PluginCronTriggerDTO();
        dto.setPluginName("report");
        dto.setCronExpression("x");

        assertThrows(IllegalArgumentException.class, () -> service.scheduleCronTrigger(dto).await().indefinitely());
    }
}
