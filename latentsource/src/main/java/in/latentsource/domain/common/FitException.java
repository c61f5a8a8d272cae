package in.latentsource.domain.common;

/**
 * Exception thrown when the blend regression is under-determined or numerically singular.
 */
public class FitException extends LatentSourceException {

    private final int rows;
    private final int columns;

    public FitException(int rows, int columns, String message) {
        super(PipelineStage.BLEND_TRAINING,
            String.format("Blend fit failed (%d rows x %d columns): %s", rows, columns, message));
        this.rows = rows;
        this.columns = columns;
    }

    public int getRows() {
        return rows;
    }

    public int getColumns() {
        return columns;
    }
}
