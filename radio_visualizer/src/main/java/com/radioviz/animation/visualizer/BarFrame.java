package com.radioviz.animation.visualizer;

import com.radioviz.animation.AnimationState;

import java.util.Arrays;

/**
 * Immutable snapshot of every bar height for one rendered frame.
 * Heights are ratios in [minBarHeight, maxBarHeight], index 0 is the leftmost bar.
 */
public record BarFrame(
    double[] heights,
    long frame,
    long timestampMs,
    AnimationState state
) {

    public BarFrame {
        heights = heights.clone();
    }

    /**
     * Frame with every bar at the same height.
     */
    public static BarFrame uniform(int barCount, double height, AnimationState state) {
        double[] heights = new double[barCount];
        Arrays.fill(heights, height);
        return new BarFrame(heights, 0, 0L, state);
    }

    /**
     * Defensive copy of the heights.
     */
    @Override
    public double[] heights() {
        return heights.clone();
    }

    public double getHeight(int index) {
        if (index < 0 || index >= heights.length) return 0.0;
        return heights[index];
    }

    public int getBarCount() {
        return heights.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BarFrame other)) return false;
        return frame == other.frame
            && timestampMs == other.timestampMs
            && state == other.state
            && Arrays.equals(heights, other.heights);
    }

    @Override
    public int hashCode() {
        int result = Arrays.hashCode(heights);
        result = 31 * result + Long.hashCode(frame);
        result = 31 * result + Long.hashCode(timestampMs);
        result = 31 * result + state.hashCode();
        return result;
    }

    @Override
    public String toString() {
        return "BarFrame[frame=" + frame + ", t=" + timestampMs + ", state=" + state.key()
            + ", heights=" + Arrays.toString(heights) + "]";
    }
}
