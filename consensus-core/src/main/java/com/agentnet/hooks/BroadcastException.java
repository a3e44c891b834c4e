package com.agentnet.hooks;

public class BroadcastException extends Exception {

    public BroadcastException(String message) {
        super(message);
    }

    public BroadcastException(String message, Throwable cause) {
        super(message, cause);
    }
}
