package com.brandpillar.agent.bus.exception;

/**
 * Thrown when an operation needs a live channel and the bus has none, either because
 * {@code connect()} was never called or because a disconnect has not been repaired yet.
 */
public class MessageBusNotConnectedException extends MessageBusException {

    public MessageBusNotConnectedException(String message) {
        super(message);
    }
}
