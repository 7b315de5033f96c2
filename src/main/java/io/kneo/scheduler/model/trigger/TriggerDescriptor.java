package io.kneo.scheduler.model.trigger;

import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Caller-side description of a schedule. Identity fields and the start time are optional;
 * blank identities are synthesized and an unset start time means "now".
 */
@Setter
@Getter
public abstract class TriggerDescriptor {
    private String name;
    private String group;
    private String jobName;
    private String jobGroup;
    private Instant startDateTime;
    private Map<String, Object> dataMap = new LinkedHashMap<>();
}
