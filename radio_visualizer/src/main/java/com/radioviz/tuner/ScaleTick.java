package com.radioviz.tuner;

/**
 * One tick mark on the dial.
 *
 * @param frequency frequency in MHz
 * @param position  horizontal position in layout pixels
 * @param kind      major (whole MHz) or minor (0.2 MHz step)
 */
public record ScaleTick(double frequency, double position, Kind kind) {

    public enum Kind {
        MAJOR,
        MINOR
    }

    public boolean isMajor() {
        return kind == Kind.MAJOR;
    }
}
