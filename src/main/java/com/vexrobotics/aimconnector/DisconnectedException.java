package com.vexrobotics.aimconnector;

/**
 * Raised when a channel is not connected, or drops in the middle of an exchange.
 */
public class DisconnectedException extends AimException {
    public DisconnectedException(String message) {
        super(message);
    }

    public DisconnectedException(String message, Throwable cause) {
        super(message, cause);
    }
}
