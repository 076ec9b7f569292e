package com.radioviz.animation;

/**
 * Receives the snapshot produced by each animation tick.
 * Called on the animation thread; implementations should hand the frame off quickly.
 */
@FunctionalInterface
public interface FrameListener<T> {

    void onFrame(T frame);
}
