package in.latentsource.domain.common;

import in.latentsource.domain.series.TimeScale;

/**
 * Exception thrown when a kernel prediction is requested against a library with no centers.
 */
public class EmptyLibraryException extends LatentSourceException {

    private final TimeScale scale;

    public EmptyLibraryException(TimeScale scale) {
        super(PipelineStage.KERNEL_PREDICTION,
            String.format("Pattern library for scale %s has no centers", scale));
        this.scale = scale;
    }

    public TimeScale getScale() {
        return scale;
    }
}
