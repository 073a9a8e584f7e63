package com.vexrobotics.aimconnector;

/**
 * Base class for every error raised by the AIM client.
 */
public class AimException extends RuntimeException {
    public AimException(String message) {
        super(message);
    }

    public AimException(String message, Throwable cause) {
        super(message, cause);
    }
}
