package io.kneo.scheduler.service.scheduler;

import io.kneo.scheduler.model.trigger.TriggerDescriptor;

/**
 * Identity as the caller asked for it. Any component may be null or blank.
 */
public record RequestedIdentity(String name, String group, String jobName, String jobGroup) {

    private static final RequestedIdentity ANONYMOUS = new RequestedIdentity(null, null, null, null);

    public static RequestedIdentity of(TriggerDescriptor descriptor) {
        return new RequestedIdentity(descriptor.getName(), descriptor.getGroup(),
                descriptor.getJobName(), descriptor.getJobGroup());
    }

    public static RequestedIdentity anonymous() {
        return ANONYMOUS;
    }
}
