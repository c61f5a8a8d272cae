package in.latentsource.domain.common;

/**
 * Exception thrown when a stage receives fewer observations than it needs.
 */
public class InsufficientDataException extends LatentSourceException {

    private final int required;
    private final int available;

    public InsufficientDataException(PipelineStage stage, String what, int required, int available) {
        super(stage, String.format("Insufficient data for %s: required %d, available %d",
            what, required, available));
        this.required = required;
        this.available = available;
    }

    public int getRequired() {
        return required;
    }

    public int getAvailable() {
        return available;
    }
}
