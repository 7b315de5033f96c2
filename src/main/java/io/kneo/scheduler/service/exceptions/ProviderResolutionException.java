package io.kneo.scheduler.service.exceptions;

public class ProviderResolutionException extends RuntimeException {

    public ProviderResolutionException(String msg) {
        super(msg);
    }

    public ProviderResolutionException(String msg, Throwable cause) {
        super(msg, cause);
    }

    public String getDeveloperMessage() {
        return getMessage();
    }
}
