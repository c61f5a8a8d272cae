package in.latentsource.domain.model;

import in.latentsource.domain.series.TimeScale;

import java.util.Map;

/**
 * The three per-scale pattern libraries built from the clustering period.
 */
public record ScaleLibraries(
    PatternLibrary shortLibrary,
    PatternLibrary mediumLibrary,
    PatternLibrary longLibrary
) {
    public ScaleLibraries {
        check(shortLibrary, TimeScale.SHORT);
        check(mediumLibrary, TimeScale.MEDIUM);
        check(longLibrary, TimeScale.LONG);
    }

    public static ScaleLibraries of(Map<TimeScale, PatternLibrary> libraries) {
        return new ScaleLibraries(
            libraries.get(TimeScale.SHORT),
            libraries.get(TimeScale.MEDIUM),
            libraries.get(TimeScale.LONG)
        );
    }

    public PatternLibrary get(TimeScale scale) {
        return switch (scale) {
            case SHORT -> shortLibrary;
            case MEDIUM -> mediumLibrary;
            case LONG -> longLibrary;
        };
    }

    /**
     * Longest window length; no timestep before it has history for every scale.
     */
    public int longestWindow() {
        return Math.max(shortLibrary.windowLength(),
            Math.max(mediumLibrary.windowLength(), longLibrary.windowLength()));
    }

    private static void check(PatternLibrary library, TimeScale expected) {
        if (library == null) {
            throw new IllegalArgumentException("Missing pattern library for scale " + expected);
        }
        if (library.scale() != expected) {
            throw new IllegalArgumentException(String.format(
                "Library for %s was built for scale %s", expected, library.scale()));
        }
    }
}
