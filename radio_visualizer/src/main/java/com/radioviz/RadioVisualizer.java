package com.radioviz;

import com.radioviz.animation.rotation.RotationAnimator;
import com.radioviz.animation.visualizer.VisualizerAnimator;
import com.radioviz.animation.visualizer.VisualizerConfig;
import com.radioviz.config.Settings;
import com.radioviz.scheduler.AnimationManager;
import com.radioviz.station.StationInfo;
import com.radioviz.tuner.FrequencyScale;

import java.util.Random;
import java.util.logging.Logger;

/**
 * Entry point for a player surface: wires settings, the shared animation scheduler,
 * the bar visualizer, the artwork rotation and the tuner dial.
 *
 * The host calls {@link #onPlaybackChanged(boolean)} whenever its transport starts or
 * stops, and pulls {@link VisualizerAnimator#currentHeights()} and
 * {@link RotationAnimator#currentRotation()} once per rendered frame.
 */
public class RadioVisualizer {

    public static final String BARS = "bars";
    public static final String ARTWORK = "artwork";

    private final Logger logger;
    private final Settings settings;
    private final AnimationManager animationManager;

    private VisualizerAnimator visualizer;
    private RotationAnimator rotation;
    private final FrequencyScale frequencyScale;
    private final StationInfo station;
    private boolean enabled = false;

    /**
     * @throws com.radioviz.config.InvalidConfigurationException if the tuner settings are invalid
     */
    public RadioVisualizer(Settings settings, AnimationManager animationManager, Logger logger) {
        this.settings = settings;
        this.animationManager = animationManager;
        this.logger = logger;
        this.frequencyScale = FrequencyScale.fromSettings(settings);
        this.station = StationInfo.fromSettings(settings);
    }

    /**
     * Build a visualizer from the bundled {@code config.json} with its own scheduler thread.
     */
    public static RadioVisualizer createDefault() {
        Logger logger = Logger.getLogger("RadioViz");
        return new RadioVisualizer(Settings.loadDefaults(logger), new AnimationManager(logger), logger);
    }

    public void enable() {
        enable(new Random());
    }

    /**
     * Register every animation. The random source drives the bar targets.
     */
    public synchronized void enable(Random random) {
        if (enabled) {
            logger.warning("RadioVisualizer already enabled");
            return;
        }

        VisualizerConfig visualizerConfig = VisualizerConfig.fromSettings(settings);
        this.visualizer = animationManager.registerVisualizer(BARS, visualizerConfig, random);
        this.rotation = animationManager.registerRotation(ARTWORK, RotationAnimator.fromSettings(settings));
        this.enabled = true;

        logger.info("RadioVisualizer enabled for " + station.name() + " (" + station.frequencyLabel()
            + "), " + visualizerConfig);
    }

    /**
     * Host transport signal.
     */
    public void onPlaybackChanged(boolean isPlaying) {
        if (!isEnabled()) {
            logger.warning("Playback change before enable() ignored");
            return;
        }
        animationManager.setPlaying(isPlaying);
    }

    public synchronized void disable() {
        if (!enabled) return;
        enabled = false;
        animationManager.shutdown();
        logger.info("RadioVisualizer disabled");
    }

    /**
     * Indicator position of the tuned station on the dial. Available before {@link #enable()}.
     */
    public double stationIndicatorPosition() {
        return frequencyScale.positionOf(station.frequency());
    }

    public synchronized boolean isEnabled() { return enabled; }
    public Settings getSettings() { return settings; }
    public AnimationManager getAnimationManager() { return animationManager; }
    public VisualizerAnimator getVisualizer() { return visualizer; }
    public RotationAnimator getRotation() { return rotation; }
    public FrequencyScale getFrequencyScale() { return frequencyScale; }
    public StationInfo getStation() { return station; }
}
