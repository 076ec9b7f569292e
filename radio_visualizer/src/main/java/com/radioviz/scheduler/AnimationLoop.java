package com.radioviz.scheduler;

import com.radioviz.animation.Animation;

import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Drives one {@link Animation} at its tick cadence and re-arms whenever the playback flag flips.
 *
 * Every armed tick carries the generation it was scheduled under. A flag flip bumps the
 * generation and cancels the pending tick, so a tick from a superseded loop that is already
 * running or queued returns without touching the animation. All mutation happens under
 * {@code lock}. Listeners run outside it and may see one last frame from before a flip.
 */
public class AnimationLoop implements AutoCloseable {

    private final Animation animation;
    private final ScheduledExecutorService scheduler;
    private final TimeSource timeSource;
    private final Logger logger;
    private final long tickIntervalMs;
    private final long stopTickIntervalMs;
    private final FrameStats stats;

    private final Object lock = new Object();
    private long generation = 0;
    private boolean playing = false;
    private boolean closed = false;
    private ScheduledFuture<?> pendingTick;

    public AnimationLoop(Animation animation,
                         ScheduledExecutorService scheduler,
                         TimeSource timeSource,
                         Logger logger,
                         long tickIntervalMs,
                         long stopTickIntervalMs) {
        if (tickIntervalMs <= 0 || stopTickIntervalMs <= 0) {
            throw new IllegalArgumentException("tick intervals must be > 0");
        }
        this.animation = Objects.requireNonNull(animation, "animation");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.timeSource = Objects.requireNonNull(timeSource, "timeSource");
        this.logger = Objects.requireNonNull(logger, "logger");
        this.tickIntervalMs = tickIntervalMs;
        this.stopTickIntervalMs = stopTickIntervalMs;
        this.stats = new FrameStats(timeSource);
    }

    /**
     * Apply the host playback signal. Repeating the current value does nothing.
     */
    public void setPlaying(boolean playing) {
        synchronized (lock) {
            if (closed) {
                logger.warning("Ignoring playback change for closed animation '" + animation.getId() + "'");
                return;
            }
            if (this.playing == playing) {
                return;
            }
            this.playing = playing;
            long armedGeneration = ++generation;
            cancelPending();
            animation.setPlaying(playing);
            arm(armedGeneration);
        }
    }

    /**
     * Run one scheduled tick. Package-private for tests that drive the loop by hand.
     *
     * The frame is computed and the next tick armed under {@code lock}; listeners are
     * notified after the lock is released.
     */
    void runTick(long tickGeneration) {
        boolean produced;
        synchronized (lock) {
            if (closed || tickGeneration != generation) {
                return;
            }
            pendingTick = null;
            try {
                produced = animation.advance(timeSource.nowMillis());
            } catch (RuntimeException e) {
                produced = false;
                stats.recordFailure();
                logger.log(Level.WARNING, "Animation '" + animation.getId() + "' tick failed", e);
            }
            arm(tickGeneration);
        }
        if (!produced) {
            return;
        }
        try {
            animation.publishFrame();
            stats.recordFrame();
        } catch (RuntimeException e) {
            stats.recordFailure();
            logger.log(Level.WARNING, "Frame listener for '" + animation.getId() + "' failed", e);
        }
    }

    private void arm(long armedGeneration) {
        if (animation.isSettled()) {
            return;
        }
        long delay = playing ? tickIntervalMs : stopTickIntervalMs;
        pendingTick = scheduler.schedule(() -> runTick(armedGeneration), delay, TimeUnit.MILLISECONDS);
    }

    private void cancelPending() {
        if (pendingTick != null) {
            pendingTick.cancel(false);
            pendingTick = null;
        }
    }

    /**
     * True while a tick is scheduled.
     */
    public boolean isRunning() {
        synchronized (lock) {
            return pendingTick != null;
        }
    }

    public boolean isPlaying() {
        synchronized (lock) {
            return playing;
        }
    }

    public boolean isClosed() {
        synchronized (lock) {
            return closed;
        }
    }

    long getGeneration() {
        synchronized (lock) {
            return generation;
        }
    }

    public Animation getAnimation() {
        return animation;
    }

    public FrameStats getStats() {
        return stats;
    }

    /**
     * Cancel any scheduled tick. The loop ignores every later call.
     */
    @Override
    public void close() {
        synchronized (lock) {
            if (closed) return;
            closed = true;
            generation++;
            cancelPending();
        }
    }
}
