package com.radioviz.animation;

/**
 * Playback-driven animation states. {@link #STOPPED} is the initial state.
 */
public enum AnimationState {
    PLAYING("playing"),
    STOPPED("stopped");

    private final String key;

    AnimationState(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public static AnimationState fromPlaying(boolean playing) {
        return playing ? PLAYING : STOPPED;
    }
}
