package com.vexrobotics.aimconnector;

/** A receive on a channel failed or timed out. */
public class ReceiveErrorException extends AimException {
    public ReceiveErrorException(String message, Throwable cause) {
        super(message, cause);
    }
}
