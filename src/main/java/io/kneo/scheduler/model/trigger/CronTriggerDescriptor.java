package io.kneo.scheduler.model.trigger;

import lombok.Getter;
import lombok.Setter;

@Setter
@Getter
public class CronTriggerDescriptor extends TriggerDescriptor {
    private String cronExpression;
}
