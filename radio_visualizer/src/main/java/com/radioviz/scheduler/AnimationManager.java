package com.radioviz.scheduler;

import com.radioviz.animation.Animation;
import com.radioviz.animation.AnimationState;
import com.radioviz.animation.rotation.RotationAnimator;
import com.radioviz.animation.visualizer.VisualizerAnimator;
import com.radioviz.animation.visualizer.VisualizerConfig;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

/**
 * Manages the animations of one player surface: registration, playback fan-out and shutdown.
 * All loops share a single scheduler thread.
 *
 * Lock order is {@code playbackLock} then the manager monitor. Loops are always called
 * with the monitor released, so frame listeners may query the manager from the
 * scheduler thread.
 */
public class AnimationManager {

    private final Logger logger;
    private final ScheduledExecutorService scheduler;
    private final TimeSource timeSource;

    /** True when the scheduler was created here and is ours to shut down */
    private final boolean ownsScheduler;

    /** Running loops by animation name */
    private final Map<String, AnimationLoop> loops = new LinkedHashMap<>();

    /** Serializes playback fan-out and registration so every loop sees flips in order */
    private final Object playbackLock = new Object();

    /** Last playback signal from the host */
    private volatile boolean playing = false;

    /**
     * Use a caller-owned scheduler. {@link #shutdown()} closes the loops but leaves it running.
     */
    public AnimationManager(Logger logger, ScheduledExecutorService scheduler, TimeSource timeSource) {
        this(logger, scheduler, timeSource, false);
    }

    public AnimationManager(Logger logger) {
        this(logger, Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "RadioViz-Animator");
            t.setDaemon(true);
            return t;
        }), TimeSource.system(), true);
    }

    private AnimationManager(Logger logger, ScheduledExecutorService scheduler, TimeSource timeSource,
                             boolean ownsScheduler) {
        this.logger = logger;
        this.scheduler = scheduler;
        this.timeSource = timeSource;
        this.ownsScheduler = ownsScheduler;
    }

    /**
     * Register an animation under a name, replacing any previous one.
     * A newly registered animation joins the current playback state immediately.
     */
    public AnimationLoop register(String name, Animation animation,
                                  long tickIntervalMs, long stopTickIntervalMs) {
        AnimationLoop loop = new AnimationLoop(animation, scheduler, timeSource, logger,
            tickIntervalMs, stopTickIntervalMs);
        synchronized (playbackLock) {
            AnimationLoop previous;
            synchronized (this) {
                previous = loops.put(name, loop);
            }
            if (previous != null) {
                previous.close();
                logger.info("Unregistered animation '" + name + "'");
            }
            if (playing) {
                loop.setPlaying(true);
            }
        }
        logger.info("Registered animation '" + animation.getId() + "' as '" + name + "'");
        return loop;
    }

    /**
     * Register a bar visualizer built from the given config.
     */
    public VisualizerAnimator registerVisualizer(String name, VisualizerConfig config, Random random) {
        VisualizerAnimator animator = new VisualizerAnimator(config, random);
        register(name, animator, config.getTickIntervalMs(), config.getStopTickIntervalMs());
        return animator;
    }

    /**
     * Register an artwork rotation. Stopping needs a single reset tick, so it reuses the run cadence.
     */
    public RotationAnimator registerRotation(String name, RotationAnimator animator) {
        register(name, animator, animator.getTickIntervalMs(), animator.getTickIntervalMs());
        return animator;
    }

    /**
     * Remove and close the loop for a name.
     */
    public void unregister(String name) {
        AnimationLoop loop;
        synchronized (this) {
            loop = loops.remove(name);
        }
        if (loop != null) {
            loop.close();
            logger.info("Unregistered animation '" + name + "'");
        }
    }

    /**
     * Fan the host playback signal out to every registered animation.
     */
    public void setPlaying(boolean playing) {
        synchronized (playbackLock) {
            if (this.playing == playing) {
                return;
            }
            this.playing = playing;
            List<AnimationLoop> targets = snapshotLoops();
            for (AnimationLoop loop : targets) {
                loop.setPlaying(playing);
            }
            logger.info("Playback " + AnimationState.fromPlaying(playing).key()
                + ", updated " + targets.size() + " animations");
        }
    }

    private synchronized List<AnimationLoop> snapshotLoops() {
        return new ArrayList<>(loops.values());
    }

    public boolean isPlaying() {
        return playing;
    }

    public synchronized Animation getAnimation(String name) {
        AnimationLoop loop = loops.get(name);
        return loop != null ? loop.getAnimation() : null;
    }

    public synchronized AnimationLoop getLoop(String name) {
        return loops.get(name);
    }

    public synchronized Set<String> getNames() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(loops.keySet()));
    }

    /**
     * Check if an animation has a tick scheduled.
     */
    public boolean isRunning(String name) {
        AnimationLoop loop = getLoop(name);
        if (loop == null) {
            logger.warning("Unknown animation: " + name);
            return false;
        }
        return loop.isRunning();
    }

    /**
     * Get list of all animations with info.
     */
    public synchronized List<Map<String, Object>> listAnimations() {
        List<Map<String, Object>> list = new ArrayList<>();
        for (Map.Entry<String, AnimationLoop> entry : loops.entrySet()) {
            Animation animation = entry.getValue().getAnimation();
            Map<String, Object> info = new HashMap<>();
            info.put("name", entry.getKey());
            info.put("id", animation.getId());
            info.put("title", animation.getName());
            info.put("description", animation.getDescription());
            info.put("state", animation.getState().key());
            info.put("frames", entry.getValue().getStats().getTotalFrames());
            list.add(info);
        }
        return list;
    }

    /**
     * Close every loop. A scheduler created by this manager is stopped too.
     */
    public void shutdown() {
        synchronized (playbackLock) {
            List<AnimationLoop> closing;
            synchronized (this) {
                closing = new ArrayList<>(loops.values());
                loops.clear();
            }
            for (AnimationLoop loop : closing) {
                loop.close();
            }
        }
        if (ownsScheduler) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(2, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                    logger.warning("Animation scheduler did not terminate gracefully");
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        logger.info("AnimationManager stopped");
    }

    /** Package-private for tests. */
    ScheduledExecutorService getScheduler() {
        return scheduler;
    }
}
