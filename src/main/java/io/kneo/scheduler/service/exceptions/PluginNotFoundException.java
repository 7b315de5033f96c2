package io.kneo.scheduler.service.exceptions;

import lombok.Getter;

@Getter
public class PluginNotFoundException extends RuntimeException {
    private final String pluginName;

    public PluginNotFoundException(String pluginName) {
        super(String.format("Error loading registered plugin %s", pluginName));
        this.pluginName = pluginName;
    }

    public String getDeveloperMessage() {
        return getMessage();
    }
}
