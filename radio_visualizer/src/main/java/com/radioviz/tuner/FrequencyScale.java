package com.radioviz.tuner;

import com.radioviz.config.Settings;
import com.radioviz.config.ValueSanitizer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.radioviz.config.InvalidConfigurationException.require;

/**
 * Layout of an FM dial: where each tick, label and the station indicator go.
 *
 *     88        89        90
 *     |  '  '  '  '  |  '  '  '  '  |
 *           ^ indicator
 *
 * Major ticks sit on whole MHz, minor ticks every 0.2 MHz between them.
 */
public class FrequencyScale {

    public static final double DEFAULT_MIN_FREQUENCY = 88.0;
    public static final double DEFAULT_MAX_FREQUENCY = 108.0;
    public static final double DEFAULT_WIDTH = 1080.0;
    public static final double DEFAULT_PADDING = 16.0;

    static final double MINOR_STEP = 0.2;
    static final int MINOR_PER_MAJOR = 4;

    /** Widest dial accepted; bounds the number of ticks and labels */
    public static final double MAX_SPAN_MHZ = 1000.0;

    // Float tolerance for range checks on 0.2 MHz steps
    private static final double TOLERANCE = 1e-9;

    private final double minFrequency;
    private final double maxFrequency;
    private final double width;
    private final double padding;

    public FrequencyScale(double minFrequency, double maxFrequency, double width, double padding) {
        require(Double.isFinite(minFrequency) && Double.isFinite(maxFrequency), "frequencies must be finite");
        require(minFrequency < maxFrequency,
            "minFrequency must be < maxFrequency, got " + minFrequency + " >= " + maxFrequency);
        require(maxFrequency - minFrequency <= MAX_SPAN_MHZ,
            "frequency span must be <= " + MAX_SPAN_MHZ + " MHz, got " + (maxFrequency - minFrequency));
        require(padding >= 0.0, "padding must be >= 0, got " + padding);
        require(width > 2 * padding, "width must exceed twice the padding, got " + width);
        this.minFrequency = minFrequency;
        this.maxFrequency = maxFrequency;
        this.width = width;
        this.padding = padding;
    }

    /**
     * Read the {@code tuner.*} section.
     */
    public static FrequencyScale fromSettings(Settings settings) {
        Settings s = settings.getSection("tuner");
        return new FrequencyScale(
            s.getDouble("min_frequency", DEFAULT_MIN_FREQUENCY),
            s.getDouble("max_frequency", DEFAULT_MAX_FREQUENCY),
            s.getDouble("width", DEFAULT_WIDTH),
            s.getDouble("padding", DEFAULT_PADDING));
    }

    /**
     * Horizontal position of a frequency. Out-of-range frequencies are pinned to the ends.
     */
    public double positionOf(double frequency) {
        double f = ValueSanitizer.sanitizeDouble(frequency, minFrequency, maxFrequency, minFrequency);
        return padding + (f - minFrequency) / getRange() * getUsableWidth();
    }

    /**
     * All ticks inside the range, ordered by frequency.
     */
    public List<ScaleTick> ticks() {
        List<ScaleTick> ticks = new ArrayList<>();
        long first = (long) Math.floor(minFrequency);
        long last = (long) Math.floor(maxFrequency);

        for (long number = first; number <= last; number++) {
            if (inRange(number)) {
                ticks.add(new ScaleTick(number, positionOf(number), ScaleTick.Kind.MAJOR));
            }
            for (int i = 1; i <= MINOR_PER_MAJOR; i++) {
                double tickFreq = roundToStep(number + i * MINOR_STEP);
                if (inRange(tickFreq)) {
                    ticks.add(new ScaleTick(tickFreq, positionOf(tickFreq), ScaleTick.Kind.MINOR));
                }
            }
        }
        return Collections.unmodifiableList(ticks);
    }

    /**
     * One label per whole MHz inside the range.
     */
    public List<ScaleLabel> labels() {
        List<ScaleLabel> labels = new ArrayList<>();
        long last = (long) Math.floor(maxFrequency);
        for (long number = (long) Math.ceil(minFrequency); number <= last; number++) {
            labels.add(new ScaleLabel(Long.toString(number), positionOf(number)));
        }
        return Collections.unmodifiableList(labels);
    }

    private boolean inRange(double frequency) {
        return frequency >= minFrequency - TOLERANCE && frequency <= maxFrequency + TOLERANCE;
    }

    private static double roundToStep(double frequency) {
        return Math.round(frequency * 10.0) / 10.0;
    }

    public double getMinFrequency() { return minFrequency; }
    public double getMaxFrequency() { return maxFrequency; }
    public double getWidth() { return width; }
    public double getPadding() { return padding; }

    public double getRange() {
        return maxFrequency - minFrequency;
    }

    public double getUsableWidth() {
        return width - 2 * padding;
    }
}
