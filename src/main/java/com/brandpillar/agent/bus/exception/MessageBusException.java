package com.brandpillar.agent.bus.exception;

/**
 * Base type of every exception raised by the agent message bus.
 */
public class MessageBusException extends RuntimeException {

    public MessageBusException(String message) {
        super(message);
    }

    public MessageBusException(String message, Throwable cause) {
        super(message, cause);
    }
}
