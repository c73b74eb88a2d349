package com.brandpillar.agent.bus.exception;

/**
 * Exception thrown when the broker refuses or fails a publish on a live channel.
 */
public class MessagePublishException extends MessageBusException {

    public MessagePublishException(String message, Throwable cause) {
        super(message, cause);
    }
}
