package com.radioviz.scheduler;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Tracks frames produced by one animation loop.
 */
public class FrameStats {

    private final TimeSource timeSource;
    private final AtomicLong totalFrames = new AtomicLong(0);
    private final AtomicLong framesThisSecond = new AtomicLong(0);
    private final AtomicLong failedFrames = new AtomicLong(0);
    private volatile long lastSecondTimestamp;
    private volatile long framesPerSecond = 0;

    public FrameStats(TimeSource timeSource) {
        this.timeSource = timeSource;
        this.lastSecondTimestamp = timeSource.nowMillis();
    }

    /**
     * Record that a frame was produced.
     */
    public void recordFrame() {
        totalFrames.incrementAndGet();
        framesThisSecond.incrementAndGet();

        long now = timeSource.nowMillis();
        if (now - lastSecondTimestamp >= 1000) {
            framesPerSecond = framesThisSecond.getAndSet(0);
            lastSecondTimestamp = now;
        }
    }

    /**
     * Record a tick that threw.
     */
    public void recordFailure() {
        failedFrames.incrementAndGet();
    }

    public long getTotalFrames() {
        return totalFrames.get();
    }

    public long getFailedFrames() {
        return failedFrames.get();
    }

    /**
     * Frames produced during the last completed one-second window.
     */
    public long getFramesPerSecond() {
        return framesPerSecond;
    }

    public void reset() {
        totalFrames.set(0);
        framesThisSecond.set(0);
        failedFrames.set(0);
        framesPerSecond = 0;
        lastSecondTimestamp = timeSource.nowMillis();
    }

    @Override
    public String toString() {
        return String.format("Frames: %d, FPS: %d, Failed: %d",
            getTotalFrames(), getFramesPerSecond(), getFailedFrames());
    }
}
