package io.kneo.scheduler.dto;

import io.kneo.scheduler.model.Plugin;
import io.kneo.scheduler.model.cnst.PluginStatus;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

@Setter
@Getter
@NoArgsConstructor
public class PluginDTO {
    private String name;
    private String assemblyPath;
    private PluginStatus status;
    private LocalDateTime regDate;

    public static PluginDTO from(Plugin plugin) {
        PluginDTO dto = new PluginDTO();
        dto.setName(plugin.getName());
        dto.setAssemblyPath(plugin.getAssemblyPath());
        dto.setStatus(plugin.getStatus());
        dto.setRegDate(plugin.getRegDate());
        return dto;
    }
}
