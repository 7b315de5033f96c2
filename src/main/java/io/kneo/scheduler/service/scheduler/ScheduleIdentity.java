package io.kneo.scheduler.service.scheduler;

import org.quartz.JobKey;
import org.quartz.TriggerKey;

public record ScheduleIdentity(TriggerKey triggerKey, JobKey jobKey) {
}
