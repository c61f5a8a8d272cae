package in.latentsource.domain.series;

/**
 * The three time scales the latent source model blends.
 *
 * Window lengths are configuration, not part of the enum; the defaults
 * below are only used when no configuration is supplied.
 */
public enum TimeScale {
    /**
     * Short scale: 180 trailing prices by default.
     */
    SHORT(180),

    /**
     * Medium scale: 360 trailing prices by default.
     */
    MEDIUM(360),

    /**
     * Long scale: 720 trailing prices by default.
     */
    LONG(720);

    private final int defaultWindowLength;

    TimeScale(int defaultWindowLength) {
        this.defaultWindowLength = defaultWindowLength;
    }

    public int getDefaultWindowLength() {
        return defaultWindowLength;
    }
}
