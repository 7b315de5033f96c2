package io.kneo.scheduler.model.trigger;

import lombok.Getter;
import lombok.Setter;

import java.time.Duration;

@Setter
@Getter
public class SimpleTriggerDescriptor extends TriggerDescriptor {
    public static final int REPEAT_FOREVER = -1;

    private Duration repeatInterval = Duration.ZERO;
    // 0 fires once
    private int repeatCount;
}
