package io.kneo.scheduler.service;

import io.kneo.scheduler.dto.SqlCronTriggerDTO;
import io.kneo.scheduler.dto.SqlSimpleTriggerDTO;
import io.kneo.scheduler.dto.SqlTriggerDTO;
import io.kneo.scheduler.model.trigger.CronTriggerDescriptor;
import io.kneo.scheduler.model.trigger.SimpleTriggerDescriptor;
import io.kneo.scheduler.model.trigger.TriggerDescriptor;
import io.kneo.scheduler.service.scheduler.SchedulerCore;
import io.kneo.scheduler.util.BlockingUni;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

@ApplicationScoped
public class SqlTriggerService {

    private final SchedulerCore schedulerCore;

    @Inject
    public SqlTriggerService(SchedulerCore schedulerCore) {
        this.schedulerCore = schedulerCore;
    }

    public Uni<Void> scheduleSimpleTrigger(SqlSimpleTriggerDTO dto) {
        SimpleTriggerDescriptor descriptor = new SimpleTriggerDescriptor();
        descriptor.setRepeatCount(dto.getRepeatCount());
        if (dto.getRepeatInterval() != null) {
            descriptor.setRepeatInterval(dto.getRepeatInterval());
        }
        return schedule(dto, descriptor);
    }

    public Uni<Void> scheduleCronTrigger(SqlCronTriggerDTO dto) {
        CronTriggerDescriptor descriptor = new CronTriggerDescriptor();
        descriptor.setCronExpression(dto.getCronExpression());
        return schedule(dto, descriptor);
    }

    private Uni<Void> schedule(SqlTriggerDTO dto, TriggerDescriptor descriptor) {
        descriptor.setName(dto.getName());
        descriptor.setGroup(dto.getGroup());
        descriptor.setJobName(dto.getJobName());
        descriptor.setJobGroup(dto.getJobGroup());
        descriptor.setStartDateTime(dto.getStartDateTime());
        descriptor.setDataMap(dto.getSqlJob().toCommand().toDataMap());
        return BlockingUni.run(() -> schedulerCore.scheduleTrigger(descriptor));
    }
}
