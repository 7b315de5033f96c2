package io.kneo.scheduler.dto;

import jakarta.validation.constraints.Min;
import lombok.Getter;
import lombok.Setter;

import java.time.Duration;

@Setter
@Getter
public class SqlSimpleTriggerDTO extends SqlTriggerDTO {
    @Min(-1)
    private int repeatCount;
    private Duration repeatInterval;
}
