package com.vexrobotics.aimconnector;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Built-in sounds, notes, and WAV/MP3 files uploaded from this machine.
 * None of the play methods wait for the sound to finish.
 */
public class Sound {
    static final Log LOG = Log.getLogger(Sound.class);

    public enum SoundType {
        DOORBELL, TADA, FAIL, SPARKLE, FLOURISH, FORWARD, REVERSE, RIGHT, LEFT, BLINKER,
        CRASH, BRAKES, HUAH, PICKUP, CHEER, SENSING, DETECTED, OBSTACLE, LOOPING, COMPLETE,
        PAUSE, RESUME, SEND, RECEIVE,
        ACT_HAPPY, ACT_SAD, ACT_EXCITED, ACT_ANGRY, ACT_SILLY
    }

    static final int MAX_NOTE_DURATION_MS = 4000;
    static final int DEFAULT_VOLUME = 50;

    private final Robot robot;

    Sound(Robot robot) {
        this.robot = robot;
    }

    public void play(SoundType sound) {
        play(sound, DEFAULT_VOLUME);
    }

    public void play(SoundType sound, int volume) {
        robot.send(Commands.playSound(sound.name().toLowerCase(), volume));
    }

    /** Plays a sound file previously stored on the robot. */
    public void playFile(String name) {
        playFile(name, DEFAULT_VOLUME);
    }

    public void playFile(String name, int volume) {
        robot.send(Commands.playFile(name, volume));
    }

    /**
     * Uploads a local WAV or MP3 file (at most 255 KiB) and plays it.
     *
     * @throws InvalidSoundFileException if the file is unusable
     */
    public void playLocalFile(String path) {
        playLocalFile(Paths.get(path), 100);
    }

    public void playLocalFile(Path path, int volume) {
        volume = Robot.clampParameterToBounds(volume, 0, 100, "playLocalFile", "volume");
        SoundUpload upload = SoundUpload.fromFile(path, volume);
        LOG.debug("uploading {} ({} bytes)", upload.getName(), upload.getDataLength());
        robot.sendAudio(upload.encode());
        markActive();
    }

    public void playNote(String note) {
        playNote(note, 750, DEFAULT_VOLUME);
    }

    /**
     * Plays a note such as "C5", "F#6" or "Bb7". Durations over 4 s are cut to 4 s.
     *
     * @throws IllegalArgumentException for a malformed note
     */
    public void playNote(String note, int durationMillis, int volume) {
        int[] parsed = parseNote(note);
        int duration = Math.min(durationMillis, MAX_NOTE_DURATION_MS);
        volume = Math.max(0, Math.min(100, volume));
        robot.send(Commands.playNote(parsed[0], parsed[1], duration, volume));
        markActive();
    }

    /**
     * @return {semitone 0..11, octave index 0..3}
     */
    static int[] parseNote(String note) {
        if (note == null || note.length() < 2 || note.length() > 3) throw invalidNote(note);
        int semitone;
        switch (Character.toLowerCase(note.charAt(0))) {
            case 'c': semitone = 0; break;
            case 'd': semitone = 2; break;
            case 'e': semitone = 4; break;
            case 'f': semitone = 5; break;
            case 'g': semitone = 7; break;
            case 'a': semitone = 9; break;
            case 'b': semitone = 11; break;
            default: throw invalidNote(note);
        }
        char octave = note.charAt(note.length() - 1);
        if (octave < '5' || octave > '8') throw invalidNote(note);
        if (note.length() == 3) {
            char accidental = note.charAt(1);
            if (accidental == '#') {
                if (semitone < 11) semitone++;
            } else if (accidental == 'b') {
                if (semitone > 0) semitone--;
            } else {
                throw invalidNote(note);
            }
        }
        return new int[] { semitone, octave - '5' };
    }

    private static IllegalArgumentException invalidNote(String note) {
        return new IllegalArgumentException("invalid note string: " + note);
    }

    // The robot takes a few status cycles to report a sound it was just given.
    private void markActive() {
        ShadowFlags flags = robot.getShadowFlags();
        flags.requestSet(RobotFlag.SOUND_PLAYING);
        flags.requestSet(RobotFlag.SOUND_DOWNLOADING);
    }

    /** True while a sound plays or is still being transferred. */
    public boolean isActive() {
        int raw = robot.getStatus().getRobotFlags();
        ShadowFlags flags = robot.getShadowFlags();
        return flags.isSet(RobotFlag.SOUND_PLAYING, raw) || flags.isSet(RobotFlag.SOUND_DOWNLOADING, raw);
    }

    public void stop() {
        robot.send(Commands.stopSound());
    }
}
