package com.radioviz.animation.visualizer;

import com.radioviz.config.Settings;

import static com.radioviz.config.InvalidConfigurationException.require;

/**
 * Immutable configuration for {@link VisualizerAnimator}. Validated on {@link Builder#build()}.
 */
public final class VisualizerConfig {

    public static final int DEFAULT_BAR_COUNT = 50;
    public static final double DEFAULT_MIN_BAR_HEIGHT = 0.1;
    public static final double DEFAULT_MAX_BAR_HEIGHT = 1.0;
    public static final double DEFAULT_SMOOTHING_FACTOR = 0.15;
    public static final double DEFAULT_EPSILON = 0.01;
    public static final long DEFAULT_REFRESH_INTERVAL_MS = 200;
    public static final int DEFAULT_MAX_DECAY_ITERATIONS = 10;
    public static final long DEFAULT_TICK_INTERVAL_MS = 33;
    public static final long DEFAULT_STOP_TICK_INTERVAL_MS = 16;

    private final int barCount;
    private final double minBarHeight;
    private final double maxBarHeight;
    private final double smoothingFactor;
    private final double epsilon;
    private final long refreshIntervalMinMs;
    private final long refreshIntervalMaxMs;
    private final int maxDecayIterations;
    private final long tickIntervalMs;
    private final long stopTickIntervalMs;

    private VisualizerConfig(Builder b) {
        this.barCount = b.barCount;
        this.minBarHeight = b.minBarHeight;
        this.maxBarHeight = b.maxBarHeight;
        this.smoothingFactor = b.smoothingFactor;
        this.epsilon = b.epsilon;
        this.refreshIntervalMinMs = b.refreshIntervalMinMs;
        this.refreshIntervalMaxMs = b.refreshIntervalMaxMs;
        this.maxDecayIterations = b.maxDecayIterations;
        this.tickIntervalMs = b.tickIntervalMs;
        this.stopTickIntervalMs = b.stopTickIntervalMs;
    }

    public static VisualizerConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Read the {@code visualizer.*} section, falling back to the defaults for missing keys.
     */
    public static VisualizerConfig fromSettings(Settings settings) {
        Settings s = settings.getSection("visualizer");
        long fixedRefresh = s.getLong("refresh_interval_ms", DEFAULT_REFRESH_INTERVAL_MS);
        return builder()
            .barCount(s.getInt("bar_count", DEFAULT_BAR_COUNT))
            .minBarHeight(s.getDouble("min_bar_height", DEFAULT_MIN_BAR_HEIGHT))
            .maxBarHeight(s.getDouble("max_bar_height", DEFAULT_MAX_BAR_HEIGHT))
            .smoothingFactor(s.getDouble("smoothing_factor", DEFAULT_SMOOTHING_FACTOR))
            .epsilon(s.getDouble("epsilon", DEFAULT_EPSILON))
            .refreshInterval(
                s.getLong("refresh_interval_min_ms", fixedRefresh),
                s.getLong("refresh_interval_max_ms", fixedRefresh))
            .maxDecayIterations(s.getInt("max_decay_iterations", DEFAULT_MAX_DECAY_ITERATIONS))
            .tickIntervalMs(s.getLong("tick_interval_ms", DEFAULT_TICK_INTERVAL_MS))
            .stopTickIntervalMs(s.getLong("stop_tick_interval_ms", DEFAULT_STOP_TICK_INTERVAL_MS))
            .build();
    }

    public int getBarCount() { return barCount; }
    public double getMinBarHeight() { return minBarHeight; }
    public double getMaxBarHeight() { return maxBarHeight; }
    public double getSmoothingFactor() { return smoothingFactor; }
    public double getEpsilon() { return epsilon; }
    public long getRefreshIntervalMinMs() { return refreshIntervalMinMs; }
    public long getRefreshIntervalMaxMs() { return refreshIntervalMaxMs; }
    public int getMaxDecayIterations() { return maxDecayIterations; }
    public long getTickIntervalMs() { return tickIntervalMs; }
    public long getStopTickIntervalMs() { return stopTickIntervalMs; }

    /**
     * Smoothing used while decaying toward the minimum: twice the playing factor, capped at 1.
     */
    public double getStopSmoothingFactor() {
        return Math.min(1.0, smoothingFactor * 2.0);
    }

    public boolean isRefreshIntervalRandomized() {
        return refreshIntervalMaxMs > refreshIntervalMinMs;
    }

    public Builder toBuilder() {
        return builder()
            .barCount(barCount)
            .minBarHeight(minBarHeight)
            .maxBarHeight(maxBarHeight)
            .smoothingFactor(smoothingFactor)
            .epsilon(epsilon)
            .refreshInterval(refreshIntervalMinMs, refreshIntervalMaxMs)
            .maxDecayIterations(maxDecayIterations)
            .tickIntervalMs(tickIntervalMs)
            .stopTickIntervalMs(stopTickIntervalMs);
    }

    @Override
    public String toString() {
        return String.format("VisualizerConfig[bars=%d, height=%.3f..%.3f, smoothing=%.3f, refresh=%d..%dms]",
            barCount, minBarHeight, maxBarHeight, smoothingFactor, refreshIntervalMinMs, refreshIntervalMaxMs);
    }

    public static class Builder {
        private int barCount = DEFAULT_BAR_COUNT;
        private double minBarHeight = DEFAULT_MIN_BAR_HEIGHT;
        private double maxBarHeight = DEFAULT_MAX_BAR_HEIGHT;
        private double smoothingFactor = DEFAULT_SMOOTHING_FACTOR;
        private double epsilon = DEFAULT_EPSILON;
        private long refreshIntervalMinMs = DEFAULT_REFRESH_INTERVAL_MS;
        private long refreshIntervalMaxMs = DEFAULT_REFRESH_INTERVAL_MS;
        private int maxDecayIterations = DEFAULT_MAX_DECAY_ITERATIONS;
        private long tickIntervalMs = DEFAULT_TICK_INTERVAL_MS;
        private long stopTickIntervalMs = DEFAULT_STOP_TICK_INTERVAL_MS;

        public Builder barCount(int barCount) {
            this.barCount = barCount;
            return this;
        }

        public Builder minBarHeight(double minBarHeight) {
            this.minBarHeight = minBarHeight;
            return this;
        }

        public Builder maxBarHeight(double maxBarHeight) {
            this.maxBarHeight = maxBarHeight;
            return this;
        }

        public Builder smoothingFactor(double smoothingFactor) {
            this.smoothingFactor = smoothingFactor;
            return this;
        }

        public Builder epsilon(double epsilon) {
            this.epsilon = epsilon;
            return this;
        }

        /**
         * Fixed target refresh interval.
         */
        public Builder refreshIntervalMs(long intervalMs) {
            return refreshInterval(intervalMs, intervalMs);
        }

        /**
         * Randomized target refresh interval, drawn per refresh from [minMs, maxMs].
         */
        public Builder refreshInterval(long minMs, long maxMs) {
            this.refreshIntervalMinMs = minMs;
            this.refreshIntervalMaxMs = maxMs;
            return this;
        }

        public Builder maxDecayIterations(int maxDecayIterations) {
            this.maxDecayIterations = maxDecayIterations;
            return this;
        }

        public Builder tickIntervalMs(long tickIntervalMs) {
            this.tickIntervalMs = tickIntervalMs;
            return this;
        }

        public Builder stopTickIntervalMs(long stopTickIntervalMs) {
            this.stopTickIntervalMs = stopTickIntervalMs;
            return this;
        }

        public VisualizerConfig build() {
            require(barCount > 0, "barCount must be > 0, got " + barCount);
            require(Double.isFinite(minBarHeight) && Double.isFinite(maxBarHeight),
                "bar heights must be finite");
            require(minBarHeight < maxBarHeight,
                "minBarHeight must be < maxBarHeight, got " + minBarHeight + " >= " + maxBarHeight);
            require(smoothingFactor > 0.0 && smoothingFactor <= 1.0,
                "smoothingFactor must be in (0, 1], got " + smoothingFactor);
            require(epsilon >= 0.0 && Double.isFinite(epsilon), "epsilon must be >= 0, got " + epsilon);
            require(refreshIntervalMinMs > 0, "refresh interval must be > 0ms, got " + refreshIntervalMinMs);
            require(refreshIntervalMaxMs >= refreshIntervalMinMs,
                "refresh interval max must be >= min, got " + refreshIntervalMinMs + ".." + refreshIntervalMaxMs);
            require(maxDecayIterations > 0, "maxDecayIterations must be > 0, got " + maxDecayIterations);
            require(tickIntervalMs > 0, "tickIntervalMs must be > 0, got " + tickIntervalMs);
            require(stopTickIntervalMs > 0, "stopTickIntervalMs must be > 0, got " + stopTickIntervalMs);
            return new VisualizerConfig(this);
        }
    }
}
