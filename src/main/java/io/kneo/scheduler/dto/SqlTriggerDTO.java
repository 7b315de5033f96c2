package io.kneo.scheduler.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

@Setter
@Getter
public abstract class SqlTriggerDTO {
    private String name;
    private String group;
    private String jobName;
    private String jobGroup;
    private Instant startDateTime;
    @Valid
    @NotNull
    private SqlJobDTO sqlJob;
}
