package io.kneo.scheduler.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.Setter;

import java.time.Duration;
import java.time.Instant;

@Setter
@Getter
public class PluginSimpleTriggerDTO {
    @NotBlank
    private String pluginName;
    private String triggerName;
    @Min(-1)
    private int repeatCount;
    private Duration repeatInterval;
    private Instant startDateTime;
}
