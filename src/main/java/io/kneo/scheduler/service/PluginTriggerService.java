package io.kneo.scheduler.service;

import io.kneo.scheduler.dto.PluginCronTriggerDTO;
import io.kneo.scheduler.dto.PluginSimpleTriggerDTO;
import io.kneo.scheduler.model.job.PluginInvocation;
import io.kneo.scheduler.model.trigger.CronTriggerDescriptor;
import io.kneo.scheduler.model.trigger.SimpleTriggerDescriptor;
import io.kneo.scheduler.model.trigger.TriggerDescriptor;
import io.kneo.scheduler.repository.PluginStore;
import io.kneo.scheduler.service.exceptions.PluginNotFoundException;
import io.kneo.scheduler.service.scheduler.SchedulerCore;
import io.kneo.scheduler.util.BlockingUni;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Supplier;

/**
 * Plugin triggers all live in the plugin's own group: job {@code Job_<plugin>} and triggers in group
 * {@code <plugin>}, so removing a plugin removes its schedules too.
 */
@ApplicationScoped
public class PluginTriggerService {
    private static final Logger LOGGER = LoggerFactory.getLogger(PluginTriggerService.class);
    public static final String JOB_PREFIX = "Job_";

    private final PluginStore pluginStore;
    private final SchedulerCore schedulerCore;

    @Inject
    public PluginTriggerService(PluginStore pluginStore, SchedulerCore schedulerCore) {
        this.pluginStore = pluginStore;
        this.schedulerCore = schedulerCore;
    }

    public Uni<Void> scheduleSimpleTrigger(PluginSimpleTriggerDTO dto) {
        LOGGER.info("Scheduling simple trigger {} for plugin {}", dto.getTriggerName(), dto.getPluginName());
        return schedule(dto.getPluginName(), () -> {
            SimpleTriggerDescriptor descriptor = new SimpleTriggerDescriptor();
            descriptor.setName(dto.getTriggerName());
            descriptor.setRepeatCount(dto.getRepeatCount());
            if (dto.getRepeatInterval() != null) {
                descriptor.setRepeatInterval(dto.getRepeatInterval());
            }
            descriptor.setStartDateTime(dto.getStartDateTime());
            return descriptor;
        });
    }

    public Uni<Void> scheduleCronTrigger(PluginCronTriggerDTO dto) {
        LOGGER.info("Scheduling cron trigger {} for plugin {}", dto.getTriggerName(), dto.getPluginName());
        return schedule(dto.getPluginName(), () -> {
            CronTriggerDescriptor descriptor = new CronTriggerDescriptor();
            descriptor.setName(dto.getTriggerName());
            descriptor.setCronExpression(dto.getCronExpression());
            descriptor.setStartDateTime(dto.getStartDateTime());
            return descriptor;
        });
    }

    public Uni<Void> removeTrigger(String pluginName, String triggerName) {
        LOGGER.info("Removing trigger {} of plugin {}", triggerName, pluginName);
        return BlockingUni.run(() -> schedulerCore.removeTrigger(triggerName, pluginName));
    }

    private Uni<Void> schedule(String pluginName, Supplier<TriggerDescriptor> descriptorFactory) {
        return pluginStore.findByName(pluginName)
                .onItem().transformToUni(plugin -> {
                    if (plugin == null) {
                        return Uni.createFrom().failure(new PluginNotFoundException(pluginName));
                    }
                    TriggerDescriptor descriptor = descriptorFactory.get();
                    descriptor.setGroup(pluginName);
                    descriptor.setJobName(JOB_PREFIX + pluginName);
                    descriptor.setJobGroup(pluginName);
                    descriptor.setDataMap(new PluginInvocation(plugin.getAssemblyPath()).toDataMap());
                    return BlockingUni.run(() -> schedulerCore.scheduleTrigger(descriptor));
                });
    }
}
