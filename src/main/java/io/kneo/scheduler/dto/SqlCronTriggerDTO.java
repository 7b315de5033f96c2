package io.kneo.scheduler.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.Setter;

@Setter
@Getter
public class SqlCronTriggerDTO extends SqlTriggerDTO {
    @NotBlank
    private String cronExpression;
}
