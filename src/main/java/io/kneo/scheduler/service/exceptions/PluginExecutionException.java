package io.kneo.scheduler.service.exceptions;

public class PluginExecutionException extends Exception {

    public PluginExecutionException(String message, Throwable cause) {
        super(message, cause);
    }

    public PluginExecutionException(String message) {
        super(message);
    }
}
