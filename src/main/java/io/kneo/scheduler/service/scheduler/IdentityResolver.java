package io.kneo.scheduler.service.scheduler;

import org.quartz.JobKey;
import org.quartz.TriggerKey;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

/**
 * Fills in whatever part of a schedule identity the caller left blank. Every synthesized
 * component is derived from one fresh token, so two anonymous requests never collide.
 */
public final class IdentityResolver {
    public static final String NAME_SUFFIX = "_Name";
    public static final String GROUP_SUFFIX = "_Group";
    public static final String JOB_SUFFIX = "_Job";
    public static final String JOB_GROUP_SUFFIX = "_JobGroup";

    private IdentityResolver() {
    }

    public static ScheduleIdentity resolve(RequestedIdentity requested) {
        return resolve(requested, UUID.randomUUID());
    }

    public static ScheduleIdentity resolve(RequestedIdentity requested, UUID token) {
        String name = orDefault(requested.name(), token + NAME_SUFFIX);
        String group = orDefault(requested.group(), token + GROUP_SUFFIX);
        String jobName = orDefault(requested.jobName(), token + JOB_SUFFIX);
        String jobGroup = orDefault(requested.jobGroup(), token + JOB_GROUP_SUFFIX);
        return new ScheduleIdentity(new TriggerKey(name, group), new JobKey(jobName, jobGroup));
    }

    /**
     * A null start time means "now". Supplied values are used untouched.
     */
    public static Instant resolveStartTime(Instant requested, Clock clock) {
        return requested != null ? requested : clock.instant();
    }

    static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String orDefault(String value, String fallback) {
        return isBlank(value) ? fallback : value;
    }
}
