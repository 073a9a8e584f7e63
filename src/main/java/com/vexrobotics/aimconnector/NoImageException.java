package com.vexrobotics.aimconnector;

public class NoImageException extends AimException {
    public NoImageException(String message) {
        super(message);
    }
}
