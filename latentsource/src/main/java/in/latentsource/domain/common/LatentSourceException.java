package in.latentsource.domain.common;

/**
 * Base class for typed pipeline failures.
 *
 * Every failure names the stage that detected it.
 */
public abstract class LatentSourceException extends RuntimeException {

    private final PipelineStage stage;

    protected LatentSourceException(PipelineStage stage, String message) {
        super(String.format("[%s] %s", stage, message));
        this.stage = stage;
    }

    protected LatentSourceException(PipelineStage stage, String message, Throwable cause) {
        super(String.format("[%s] %s", stage, message), cause);
        this.stage = stage;
    }

    public PipelineStage getStage() {
        return stage;
    }
}
