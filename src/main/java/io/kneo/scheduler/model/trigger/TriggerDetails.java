package io.kneo.scheduler.model.trigger;

import org.quartz.Trigger;

import java.time.Instant;
import java.util.Date;

/**
 * Read-only snapshot of a trigger as the engine currently sees it. All instants are UTC.
 * Fire times stay null until the engine has computed them.
 */
public record TriggerDetails(String name,
                             String group,
                             String jobName,
                             String jobGroup,
                             String description,
                             Instant startTimeUtc,
                             Instant nextFireTimeUtc,
                             Instant previousFireTimeUtc,
                             Instant endTimeUtc,
                             Instant finalFireTimeUtc) {

    public static TriggerDetails from(Trigger trigger) {
        return new TriggerDetails(
                trigger.getKey().getName(),
                trigger.getKey().getGroup(),
                trigger.getJobKey().getName(),
                trigger.getJobKey().getGroup(),
                trigger.getDescription(),
                toInstant(trigger.getStartTime()),
                toInstant(trigger.getNextFireTime()),
                toInstant(trigger.getPreviousFireTime()),
                toInstant(trigger.getEndTime()),
                toInstant(trigger.getFinalFireTime()));
    }

    private static Instant toInstant(Date date) {
        return date == null ? null : date.toInstant();
    }
}
