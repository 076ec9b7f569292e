package com.radioviz;

import com.radioviz.animation.AnimationState;
import com.radioviz.config.Settings;
import com.radioviz.scheduler.AnimationLoop;
import com.radioviz.scheduler.AnimationManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Random;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;

/**
 * Tests for RadioVisualizer wiring from settings.
 */
class RadioVisualizerTest {

    private static final Logger LOGGER = Logger.getLogger("RadioVisualizerTest");

    private ScheduledExecutorService scheduler;
    private AnimationManager manager;

    @BeforeEach
    void setUp() {
        scheduler = Mockito.mock(ScheduledExecutorService.class);
        ScheduledFuture<?> future = Mockito.mock(ScheduledFuture.class);
        Mockito.doReturn(future).when(scheduler).schedule(any(Runnable.class), anyLong(), any(TimeUnit.class));
        manager = new AnimationManager(LOGGER, scheduler, () -> 0L);
    }

    private static Settings testSettings() throws IOException {
        try (InputStream in = RadioVisualizerTest.class.getClassLoader()
                .getResourceAsStream("randomized-refresh.json")) {
            assertNotNull(in, "test settings resource missing");
            return Settings.fromJson(new String(in.readAllBytes(), StandardCharsets.UTF_8));
        }
    }

    @Test
    @DisplayName("enable() builds every component from settings")
    void enableWiresComponents() throws IOException {
        RadioVisualizer visualizer = new RadioVisualizer(testSettings(), manager, LOGGER);

        visualizer.enable(new Random(4));

        assertTrue(visualizer.isEnabled());
        assertEquals(12, visualizer.getVisualizer().getConfig().getBarCount());
        assertTrue(visualizer.getVisualizer().getConfig().isRefreshIntervalRandomized());
        assertEquals(1000, visualizer.getRotation().getTotalDurationMs());
        assertEquals(87.5, visualizer.getFrequencyScale().getMinFrequency());
        assertEquals("Test FM", visualizer.getStation().name());
        assertFalse(visualizer.getStation().hasVideoStream());
        assertTrue(manager.getNames().contains(RadioVisualizer.BARS));
        assertTrue(manager.getNames().contains(RadioVisualizer.ARTWORK));
    }

    @Test
    @DisplayName("Playback changes reach the bars and the artwork")
    void playbackReachesAnimations() throws IOException {
        RadioVisualizer visualizer = new RadioVisualizer(testSettings(), manager, LOGGER);
        visualizer.enable(new Random(4));

        visualizer.onPlaybackChanged(true);

        assertEquals(AnimationState.PLAYING, visualizer.getVisualizer().getState());
        assertEquals(AnimationState.PLAYING, visualizer.getRotation().getState());

        visualizer.onPlaybackChanged(false);

        assertEquals(AnimationState.STOPPED, visualizer.getVisualizer().getState());
        assertEquals(0.0, visualizer.getRotation().currentRotation());
    }

    @Test
    @DisplayName("Playback changes before enable() are ignored")
    void playbackBeforeEnableIgnored() {
        RadioVisualizer visualizer = new RadioVisualizer(Settings.empty(), manager, LOGGER);

        visualizer.onPlaybackChanged(true);

        assertFalse(manager.isPlaying());
    }

    @Test
    @DisplayName("Station indicator sits on the dial at the tuned frequency")
    void stationIndicator() throws IOException {
        RadioVisualizer visualizer = new RadioVisualizer(testSettings(), manager, LOGGER);
        visualizer.enable(new Random(4));

        double position = visualizer.stationIndicatorPosition();

        assertEquals(visualizer.getFrequencyScale().positionOf(89.1), position, 1e-9);
        assertTrue(position > visualizer.getFrequencyScale().positionOf(89.0));
    }

    @Test
    @DisplayName("Station indicator is available before enable()")
    void stationIndicatorBeforeEnable() throws IOException {
        RadioVisualizer visualizer = new RadioVisualizer(testSettings(), manager, LOGGER);

        assertEquals(visualizer.getFrequencyScale().positionOf(89.1), visualizer.stationIndicatorPosition(), 1e-9);
        assertFalse(visualizer.isEnabled());
    }

    @Test
    @DisplayName("disable() closes the animations once and leaves the injected scheduler alone")
    void disableClosesAnimations() {
        RadioVisualizer visualizer = new RadioVisualizer(Settings.empty(), manager, LOGGER);
        visualizer.enable(new Random(4));
        AnimationLoop bars = manager.getLoop(RadioVisualizer.BARS);

        visualizer.disable();
        visualizer.disable();

        assertFalse(visualizer.isEnabled());
        assertTrue(bars.isClosed());
        assertTrue(manager.getNames().isEmpty());
        Mockito.verify(scheduler, Mockito.never()).shutdown();
    }
}
