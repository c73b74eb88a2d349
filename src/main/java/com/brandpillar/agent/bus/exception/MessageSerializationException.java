package com.brandpillar.agent.bus.exception;

/**
 * A message body could not be written as, or read from, JSON.
 */
public class MessageSerializationException extends MessageBusException {

    public MessageSerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
