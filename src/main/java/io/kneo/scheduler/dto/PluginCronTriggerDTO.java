package io.kneo.scheduler.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

@Setter
@Getter
public class PluginCronTriggerDTO {
    @NotBlank
    private String pluginName;
    private String triggerName;
    @NotBlank
    private String cronExpression;
    private Instant startDateTime;
}
