package com.radioviz.animation.visualizer;

import com.radioviz.animation.Animation;
import com.radioviz.animation.AnimationState;
import com.radioviz.animation.FrameListener;
import com.radioviz.config.ValueSanitizer;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Simulated spectrum bars.
 *
 * While playing, each bar eases toward a random target and all targets are resampled
 * once the refresh interval has elapsed. When stopped, bars decay toward the minimum
 * height at twice the playing smoothing for a bounded number of ticks, then snap to it.
 *
 * Layout:
 *   |      |     |
 *   | |    | |   |  |
 *   | | |  | | | |  | |
 *   bar 0 ........ bar N-1
 */
public class VisualizerAnimator extends Animation {

    private static final long UNSET = Long.MIN_VALUE;

    private final VisualizerConfig config;
    private final Random random;
    private final double[] current;
    private final double[] targets;
    private final List<FrameListener<BarFrame>> listeners = new CopyOnWriteArrayList<>();

    private AnimationState state = AnimationState.STOPPED;
    private boolean settled = true;
    private int decayIterations = 0;

    // Animation clock
    private long lastRefreshMs = UNSET;
    private long refreshIntervalMs;

    private long frameCounter = 0;
    private volatile BarFrame snapshot;

    public VisualizerAnimator(VisualizerConfig config, Random random) {
        super("bars", "Audio Visualizer Bars", "Bars easing toward random heights while audio is playing");
        this.config = Objects.requireNonNull(config, "config");
        this.random = Objects.requireNonNull(random, "random");
        this.current = new double[config.getBarCount()];
        this.targets = new double[config.getBarCount()];
        Arrays.fill(current, config.getMinBarHeight());
        Arrays.fill(targets, config.getMinBarHeight());
        this.refreshIntervalMs = config.getRefreshIntervalMinMs();
        this.snapshot = BarFrame.uniform(config.getBarCount(), config.getMinBarHeight(), state);
    }

    public VisualizerAnimator(VisualizerConfig config) {
        this(config, new Random());
    }

    public VisualizerConfig getConfig() {
        return config;
    }

    @Override
    public void start() {
        if (state == AnimationState.PLAYING) {
            return;
        }
        state = AnimationState.PLAYING;
        settled = false;
        decayIterations = 0;
        resampleTargets();
        // The refresh timer starts from the first tick after entering PLAYING
        lastRefreshMs = UNSET;
    }

    @Override
    public void stop() {
        if (state == AnimationState.STOPPED) {
            return;
        }
        state = AnimationState.STOPPED;
        decayIterations = 0;
        settled = false;
    }

    @Override
    public boolean advance(long nowMs) {
        if (settled) {
            return false;
        }
        if (state == AnimationState.PLAYING) {
            tickPlaying(nowMs);
        } else {
            tickDecay();
        }
        frameCounter++;
        snapshot = new BarFrame(current, frameCounter, nowMs, state);
        return true;
    }

    @Override
    public void publishFrame() {
        BarFrame frame = snapshot;
        for (FrameListener<BarFrame> listener : listeners) {
            listener.onFrame(frame);
        }
    }

    private void tickPlaying(long nowMs) {
        if (lastRefreshMs == UNSET) {
            lastRefreshMs = nowMs;
        } else if (nowMs - lastRefreshMs > refreshIntervalMs) {
            resampleTargets();
            lastRefreshMs = nowMs;
        }
        double factor = config.getSmoothingFactor();
        for (int i = 0; i < current.length; i++) {
            current[i] = step(current[i], targets[i], factor);
        }
    }

    private void tickDecay() {
        double min = config.getMinBarHeight();
        double factor = config.getStopSmoothingFactor();
        boolean allAtMin = true;
        for (int i = 0; i < current.length; i++) {
            current[i] = step(current[i], min, factor);
            if (current[i] != min) {
                allAtMin = false;
            }
        }
        decayIterations++;
        if (allAtMin || decayIterations >= config.getMaxDecayIterations()) {
            Arrays.fill(current, min);
            Arrays.fill(targets, min);
            settled = true;
        }
    }

    /**
     * Close {@code factor} of the distance to the target, snapping once within epsilon.
     */
    private double step(double value, double target, double factor) {
        double next = value + (target - value) * factor;
        if (Math.abs(target - next) < config.getEpsilon()) {
            next = target;
        }
        return ValueSanitizer.sanitizeHeight(next, config.getMinBarHeight(), config.getMaxBarHeight());
    }

    private void resampleTargets() {
        double min = config.getMinBarHeight();
        double range = config.getMaxBarHeight() - min;
        for (int i = 0; i < targets.length; i++) {
            targets[i] = ValueSanitizer.sanitizeHeight(
                min + random.nextDouble() * range, min, config.getMaxBarHeight());
        }
        if (config.isRefreshIntervalRandomized()) {
            long span = config.getRefreshIntervalMaxMs() - config.getRefreshIntervalMinMs();
            refreshIntervalMs = ValueSanitizer.sanitizeLong(
                config.getRefreshIntervalMinMs() + (long) (random.nextDouble() * (span + 1)),
                config.getRefreshIntervalMinMs(), config.getRefreshIntervalMaxMs());
        }
    }

    /**
     * Read-only snapshot of the current bar heights. Safe to call from any thread.
     */
    public BarFrame currentHeights() {
        return snapshot;
    }

    /**
     * Copy of the heights each bar is easing toward.
     */
    public double[] currentTargets() {
        return targets.clone();
    }

    public void addListener(FrameListener<BarFrame> listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeListener(FrameListener<BarFrame> listener) {
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

    /**
     * Ticks applied since the last transition into STOPPED.
     */
    public int getDecayIterations() {
        return decayIterations;
    }

    public long getRefreshIntervalMs() {
        return refreshIntervalMs;
    }
}
