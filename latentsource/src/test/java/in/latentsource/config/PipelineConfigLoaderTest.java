package in.latentsource.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for PipelineConfigLoader.
 *
 * Tests:
 * - Partial JSON merged over defaults
 * - Classpath and file loading
 * - System property overrides
 * - Validation of loaded values
 */
class PipelineConfigLoaderTest {

    private final PipelineConfigLoader loader = new PipelineConfigLoader();

    @AfterEach
    void clearOverrides() {
        System.clearProperty(PipelineConfigLoader.SEED_KEY);
        System.clearProperty(PipelineConfigLoader.THRESHOLD_KEY);
        System.clearProperty(PipelineConfigLoader.STRIDE_KEY);
        System.clearProperty(PipelineConfigLoader.PARALLELISM_KEY);
    }

    @Test
    void testPartialJsonKeepsDefaults() throws IOException {
        PipelineConfig config = loader.fromStream(json(
            "{\"mediumScale\": {\"windowLength\": 400}, \"trading\": {\"stride\": 5}}"));

        assertEquals(400, config.mediumScale().windowLength());
        assertEquals(100, config.mediumScale().clusterCount(), "Nested fields not in the JSON keep defaults");
        assertEquals(20, config.mediumScale().effectiveCount());
        assertEquals(180, config.shortScale().windowLength());
        assertEquals(720, config.longScale().windowLength());
        assertEquals(5, config.trading().stride());
        assertEquals(1e-4, config.trading().threshold());
        assertEquals(ClusteringConfig.defaults(), config.clustering());
    }

    @Test
    void testEmptyObjectGivesDefaults() throws IOException {
        PipelineConfig config = loader.fromStream(json("{}"));

        assertEquals(PipelineConfig.defaults(), config);
    }

    @Test
    void testNonObjectRejected() {
        assertThrows(IllegalArgumentException.class, () -> loader.fromStream(json("[1, 2, 3]")));
    }

    @Test
    void testClasspathResourceMatchesDefaults() {
        PipelineConfig config = loader.fromClasspath(PipelineConfigLoader.DEFAULT_RESOURCE);

        assertEquals(180, config.shortScale().windowLength());
        assertEquals(360, config.mediumScale().windowLength());
        assertEquals(720, config.longScale().windowLength());
        assertEquals(42L, config.clustering().seed());
        assertEquals(10, config.clustering().restarts());
        assertEquals(TradingConfig.defaults(), config.trading());
    }

    @Test
    void testMissingClasspathResourceFallsBackToDefaults() {
        assertEquals(PipelineConfig.defaults(), loader.fromClasspath("no-such-config.json"));
    }

    @Test
    void testFileLoading(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("config.json");
        Files.writeString(file, "{\"clustering\": {\"seed\": 99, \"restarts\": 2}, \"parallelism\": 3}");

        PipelineConfig config = loader.fromFile(file);

        assertEquals(99L, config.clustering().seed());
        assertEquals(2, config.clustering().restarts());
        assertEquals(300, config.clustering().maxIterations());
        assertEquals(3, config.parallelism());
    }

    @Test
    void testSystemPropertyOverrides() {
        System.setProperty(PipelineConfigLoader.SEED_KEY, "123");
        System.setProperty(PipelineConfigLoader.THRESHOLD_KEY, "0.002");
        System.setProperty(PipelineConfigLoader.STRIDE_KEY, "4");
        System.setProperty(PipelineConfigLoader.PARALLELISM_KEY, "2");

        PipelineConfig config = loader.applyOverrides(PipelineConfig.defaults());

        assertEquals(123L, config.clustering().seed());
        assertEquals(0.002, config.trading().threshold());
        assertEquals(4, config.trading().stride());
        assertEquals(2, config.parallelism());
        assertEquals(300, config.clustering().maxIterations(), "Other clustering fields untouched");
    }

    @Test
    void testMalformedOverrideRejected() {
        System.setProperty(PipelineConfigLoader.STRIDE_KEY, "every");

        assertThrows(IllegalArgumentException.class, () -> loader.applyOverrides(PipelineConfig.defaults()));
    }

    @Test
    void testValidationNamesInvalidSection() {
        PipelineConfig config = PipelineConfig.defaults().withTrading(new TradingConfig(0.0, 0));

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, config::validate);
        assertTrue(e.getMessage().contains("trading"), "Message: " + e.getMessage());
    }

    @Test
    void testEffectiveCountAboveClusterCountInvalid() throws IOException {
        PipelineConfig config = loader.fromStream(json("{\"longScale\": {\"clusterCount\": 10, \"effectiveCount\": 11}}"));

        assertFalse(config.longScale().isValid());
        assertThrows(IllegalArgumentException.class, config::validate);
    }

    private static InputStream json(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }
}
