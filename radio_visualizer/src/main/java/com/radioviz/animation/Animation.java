package com.radioviz.animation;

/**
 * Base class for playback-driven animations.
 *
 * An animation is advanced one frame at a time by {@link #tick(long)} and switched
 * between {@link AnimationState#PLAYING} and {@link AnimationState#STOPPED} by the
 * host's playback signal. Implementations are not thread-safe; the owning loop
 * serializes every call.
 *
 * A tick has two halves. {@link #advance(long)} mutates state and must run under the
 * owner's lock; {@link #publishFrame()} hands the latest frame to listeners and runs
 * with no lock held, so listeners may call back into the code that owns the loop.
 */
public abstract class Animation {

    private final String id;
    private final String name;
    private final String description;

    protected Animation(String id, String name, String description) {
        this.id = id;
        this.name = name;
        this.description = description;
    }

    public String getId() { return id; }
    public String getName() { return name; }
    public String getDescription() { return description; }

    /**
     * Enter the playing state. Calling this while already playing has no effect.
     */
    public abstract void start();

    /**
     * Enter the stopped state. Calling this while already stopped has no effect.
     */
    public abstract void stop();

    /**
     * Advance by one frame and notify listeners.
     *
     * @param nowMs monotonic timestamp in milliseconds
     */
    public final void tick(long nowMs) {
        if (advance(nowMs)) {
            publishFrame();
        }
    }

    /**
     * Compute the next frame without notifying anyone.
     *
     * @param nowMs monotonic timestamp in milliseconds
     * @return false when nothing changed, e.g. once settled
     */
    public abstract boolean advance(long nowMs);

    /**
     * Notify listeners of the most recent frame.
     */
    public abstract void publishFrame();

    public abstract AnimationState getState();

    /**
     * True when further ticks would not change anything until the next
     * {@link #start()} or {@link #stop()}.
     */
    public abstract boolean isSettled();

    /**
     * Apply the host playback signal.
     */
    public final void setPlaying(boolean playing) {
        if (playing) {
            start();
        } else {
            stop();
        }
    }

    public boolean isPlaying() {
        return getState() == AnimationState.PLAYING;
    }
}
