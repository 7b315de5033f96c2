package io.kneo.scheduler.model.cnst;

public enum PluginStatus {
    REGISTERED
}
