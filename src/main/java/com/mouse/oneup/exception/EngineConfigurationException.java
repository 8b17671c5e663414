package com.mouse.oneup.exception;

public class EngineConfigurationException extends RuntimeException {
    public EngineConfigurationException() {
        super();
    }

    public EngineConfigurationException(String message) {
        super(message);
    }

    public EngineConfigurationException(String message, Throwable e) {
        super(message, e);
    }
}
