package io.kneo.scheduler.model;

import io.kneo.scheduler.model.cnst.PluginStatus;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

@Setter
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class Plugin {
    private String name;
    private String assemblyPath;
    private PluginStatus status;
    private LocalDateTime regDate;

    public Plugin(String name, String assemblyPath, PluginStatus status) {
        this(name, assemblyPath, status, null);
    }
}
