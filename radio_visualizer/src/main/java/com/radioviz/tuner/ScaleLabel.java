package com.radioviz.tuner;

/**
 * Text drawn above a major tick.
 */
public record ScaleLabel(String text, double position) {
}
