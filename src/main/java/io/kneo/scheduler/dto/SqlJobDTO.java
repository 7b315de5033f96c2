package io.kneo.scheduler.dto;

import io.kneo.scheduler.model.cnst.CommandStyle;
import io.kneo.scheduler.model.job.SqlCommand;
import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.Setter;

@Setter
@Getter
public class SqlJobDTO {
    @NotBlank
    private String connectionString;
    @NotBlank
    private String nonQueryCommand;
    @NotBlank
    private String providerAssemblyName;
    @NotBlank
    private String connectionClass;
    @NotBlank
    private String commandClass;
    @NotBlank
    private String dataAdapterClass;
    private String commandStyle;

    public SqlCommand toCommand() {
        return new SqlCommand(connectionString, nonQueryCommand, providerAssemblyName, connectionClass,
                commandClass, dataAdapterClass, CommandStyle.of(commandStyle));
    }
}
