package in.latentsource.domain.common;

/**
 * Exception thrown when a window length is not strictly between zero and the series length.
 */
public class InvalidWindowLengthException extends LatentSourceException {

    private final int windowLength;
    private final int seriesLength;

    public InvalidWindowLengthException(int windowLength, int seriesLength) {
        super(PipelineStage.WINDOW_EXTRACTION,
            String.format("Window length %d is invalid for a series of %d prices (need 0 < n < %d)",
                windowLength, seriesLength, seriesLength));
        this.windowLength = windowLength;
        this.seriesLength = seriesLength;
    }

    public int getWindowLength() {
        return windowLength;
    }

    public int getSeriesLength() {
        return seriesLength;
    }
}
