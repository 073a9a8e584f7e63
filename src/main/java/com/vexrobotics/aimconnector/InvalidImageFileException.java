package com.vexrobotics.aimconnector;

public class InvalidImageFileException extends AimException {
    public InvalidImageFileException(String message) {
        super(message);
    }
}
