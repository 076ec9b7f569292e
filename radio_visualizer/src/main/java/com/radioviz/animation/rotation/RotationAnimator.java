package com.radioviz.animation.rotation;

import com.radioviz.animation.Animation;
import com.radioviz.animation.AnimationState;
import com.radioviz.animation.FrameListener;
import com.radioviz.config.Settings;
import com.radioviz.config.ValueSanitizer;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

import static com.radioviz.config.InvalidConfigurationException.require;

/**
 * Artwork rotation that runs a fixed number of full turns after playback starts.
 *
 * Rotation is driven by elapsed time rather than tick count, so the run always ends
 * at exactly {@code 360 * repetitions} degrees. Stopping snaps back to 0.
 */
public class RotationAnimator extends Animation {

    public static final long DEFAULT_REVOLUTION_DURATION_MS = 3000;
    public static final int DEFAULT_REPETITIONS = 2;
    public static final long DEFAULT_TICK_INTERVAL_MS = 33;

    private static final long UNSET = Long.MIN_VALUE;

    private final long revolutionDurationMs;
    private final int repetitions;
    private final long tickIntervalMs;
    private final List<FrameListener<Double>> listeners = new CopyOnWriteArrayList<>();

    private AnimationState state = AnimationState.STOPPED;
    private boolean settled = true;
    private long runStartMs = UNSET;
    private volatile double rotation = 0.0;

    public RotationAnimator(long revolutionDurationMs, int repetitions, long tickIntervalMs) {
        super("artwork", "Artwork Rotation", "Station artwork turning while a stream starts");
        require(revolutionDurationMs > 0, "revolutionDurationMs must be > 0, got " + revolutionDurationMs);
        require(repetitions > 0, "repetitions must be > 0, got " + repetitions);
        require(tickIntervalMs > 0, "tickIntervalMs must be > 0, got " + tickIntervalMs);
        this.revolutionDurationMs = revolutionDurationMs;
        this.repetitions = repetitions;
        this.tickIntervalMs = tickIntervalMs;
    }

    public RotationAnimator() {
        this(DEFAULT_REVOLUTION_DURATION_MS, DEFAULT_REPETITIONS, DEFAULT_TICK_INTERVAL_MS);
    }

    /**
     * Read the {@code rotation.*} section.
     */
    public static RotationAnimator fromSettings(Settings settings) {
        Settings s = settings.getSection("rotation");
        return new RotationAnimator(
            s.getLong("revolution_duration_ms", DEFAULT_REVOLUTION_DURATION_MS),
            s.getInt("repetitions", DEFAULT_REPETITIONS),
            s.getLong("tick_interval_ms", DEFAULT_TICK_INTERVAL_MS));
    }

    @Override
    public void start() {
        if (state == AnimationState.PLAYING) {
            return;
        }
        state = AnimationState.PLAYING;
        settled = false;
        rotation = 0.0;
        runStartMs = UNSET;
    }

    @Override
    public void stop() {
        if (state == AnimationState.STOPPED) {
            return;
        }
        state = AnimationState.STOPPED;
        rotation = 0.0;
        runStartMs = UNSET;
        // One more tick publishes the reset to listeners
        settled = false;
    }

    @Override
    public boolean advance(long nowMs) {
        if (settled) {
            return false;
        }
        if (state == AnimationState.STOPPED) {
            settled = true;
            return true;
        }

        if (runStartMs == UNSET) {
            runStartMs = nowMs;
        }
        double progress = ValueSanitizer.sanitizeProgress(
            (double) (nowMs - runStartMs) / (double) getTotalDurationMs());
        if (progress >= 1.0) {
            rotation = getTotalDegrees();
            settled = true;
        } else {
            rotation = getTotalDegrees() * progress;
        }
        return true;
    }

    @Override
    public void publishFrame() {
        double degrees = rotation;
        for (FrameListener<Double> listener : listeners) {
            listener.onFrame(degrees);
        }
    }

    /**
     * Current rotation in degrees, within [0, 360 * repetitions].
     */
    public double currentRotation() {
        return rotation;
    }

    public long getTotalDurationMs() {
        return revolutionDurationMs * repetitions;
    }

    public double getTotalDegrees() {
        return 360.0 * repetitions;
    }

    public long getRevolutionDurationMs() { return revolutionDurationMs; }
    public int getRepetitions() { return repetitions; }
    public long getTickIntervalMs() { return tickIntervalMs; }

    public void addListener(FrameListener<Double> listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeListener(FrameListener<Double> listener) {
        listeners.remove(listener);
    }

    @Override
    public AnimationState getState() {
        return state;
    }

    @Override
    public boolean isSettled() {
        return settled;
    }
}
