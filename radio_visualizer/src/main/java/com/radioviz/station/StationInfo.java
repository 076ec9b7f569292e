package com.radioviz.station;

import com.radioviz.config.Settings;

import java.util.Locale;

/**
 * Station the player is tuned to. Read from the {@code station.*} settings section.
 */
public record StationInfo(
    String name,
    double frequency,
    String streamUrl,
    String videoStreamUrl
) {

    public static final String DEFAULT_NAME = "Dennery FM";
    public static final double DEFAULT_FREQUENCY = 88.9;
    public static final String DEFAULT_STREAM_URL = "https://c21.radioboss.fm:8062/stream";
    public static final String DEFAULT_VIDEO_STREAM_URL =
        "https://broadcast.denneryfm.com:5443/LiveApp/streams/TX4JtCSfc98m21875890490519672.m3u8";

    public static StationInfo fromSettings(Settings settings) {
        Settings s = settings.getSection("station");
        return new StationInfo(
            s.getString("name", DEFAULT_NAME),
            s.getDouble("frequency", DEFAULT_FREQUENCY),
            s.getString("stream_url", DEFAULT_STREAM_URL),
            s.getString("video_stream_url", DEFAULT_VIDEO_STREAM_URL));
    }

    /**
     * Dial text, e.g. "88.9 FM".
     */
    public String frequencyLabel() {
        return String.format(Locale.ROOT, "%.1f FM", frequency);
    }

    public boolean hasVideoStream() {
        return videoStreamUrl != null && !videoStreamUrl.isBlank();
    }
}
