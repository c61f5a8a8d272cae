package in.latentsource.util;

import in.latentsource.domain.common.EmptyLibraryException;
import in.latentsource.domain.series.TimeScale;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

class TasksTest {

    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(2);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void testCollectsResultsInSubmissionOrder() {
        List<Future<Integer>> futures = List.of(
            executor.submit(() -> 1), executor.submit(() -> 2), executor.submit(() -> 3));

        assertEquals(List.of(1, 2, 3), Tasks.awaitAll(futures));
    }

    @Test
    void testRethrowsTypedFailureUnwrapped() {
        Callable<Integer> failing = () -> {
            throw new EmptyLibraryException(TimeScale.LONG);
        };
        List<Future<Integer>> futures = List.of(executor.submit(() -> 1), executor.submit(failing));

        EmptyLibraryException e = assertThrows(EmptyLibraryException.class, () -> Tasks.awaitAll(futures));
        assertEquals(TimeScale.LONG, e.getScale());
    }

    @Test
    void testWrapsCheckedFailure() {
        Callable<Integer> failing = () -> {
            throw new IOException("disk");
        };
        List<Future<Integer>> futures = List.of(executor.submit(failing));

        IllegalStateException e = assertThrows(IllegalStateException.class, () -> Tasks.awaitAll(futures));
        assertInstanceOf(IOException.class, e.getCause());
    }
}
