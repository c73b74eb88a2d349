package com.brandpillar.agent.bus.exception;

/**
 * Thrown when the broker cannot be dialed or the channel cannot be set up.
 *
 * <p>Only surfaces from an explicit {@code connect()}; later connection failures are
 * handled by background reconnection.
 */
public class MessageBusConnectionException extends MessageBusException {

    public MessageBusConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
