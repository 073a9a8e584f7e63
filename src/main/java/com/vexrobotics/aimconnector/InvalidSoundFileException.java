package com.vexrobotics.aimconnector;

/** A sound file was rejected before upload (extension, size or WAVE format). */
public class InvalidSoundFileException extends AimException {
    public InvalidSoundFileException(String message) {
        super(message);
    }

    public InvalidSoundFileException(String message, Throwable cause) {
        super(message, cause);
    }
}
