package com.vexrobotics.aimconnector;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Note names")
class SoundTest {

    @Test
    @DisplayName("naturals map to semitones and octaves 5 to 8 to 0 to 3")
    void testNaturals() {
        assertArrayEquals(new int[] { 0, 0 }, Sound.parseNote("C5"));
        assertArrayEquals(new int[] { 9, 3 }, Sound.parseNote("a8"));
        assertArrayEquals(new int[] { 11, 1 }, Sound.parseNote("B6"));
    }

    @Test
    @DisplayName("sharps and flats shift by one, within the octave")
    void testAccidentals() {
        assertArrayEquals(new int[] { 6, 1 }, Sound.parseNote("F#6"));
        assertArrayEquals(new int[] { 10, 2 }, Sound.parseNote("Bb7"));
        assertArrayEquals(new int[] { 11, 0 }, Sound.parseNote("B#5"));
        assertArrayEquals(new int[] { 0, 0 }, Sound.parseNote("Cb5"));
    }

    @Test
    @DisplayName("malformed notes are rejected")
    void testInvalid() {
        for (String note : new String[] { "", "C", "H5", "C4", "C9", "C#", "Cx5", "C#55", null }) {
            assertThrows(IllegalArgumentException.class, () -> Sound.parseNote(note), String.valueOf(note));
        }
    }
}
