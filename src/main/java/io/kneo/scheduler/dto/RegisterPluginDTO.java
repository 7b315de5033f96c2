package io.kneo.scheduler.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.Setter;

@Setter
@Getter
public class RegisterPluginDTO {
    @NotBlank
    private String name;
    @NotBlank
    private String assemblyPath;
}
