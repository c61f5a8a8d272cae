package in.latentsource.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.latentsource.util.Env;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Map;

/**
 * Loads {@link PipelineConfig} from JSON.
 *
 * Resolution order:
 * 1. {@link PipelineConfig#defaults()}
 * 2. JSON file named by LATENT_SOURCE_CONFIG, else classpath resource latent-source.json
 *    (fields present in the JSON replace the defaults, nested objects are merged)
 * 3. LATENT_SOURCE_SEED / _THRESHOLD / _STRIDE / _PARALLELISM overrides
 */
public final class PipelineConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(PipelineConfigLoader.class);

    public static final String CONFIG_PATH_KEY = "LATENT_SOURCE_CONFIG";
    public static final String DEFAULT_RESOURCE = "latent-source.json";

    public static final String SEED_KEY = "LATENT_SOURCE_SEED";
    public static final String THRESHOLD_KEY = "LATENT_SOURCE_THRESHOLD";
    public static final String STRIDE_KEY = "LATENT_SOURCE_STRIDE";
    public static final String PARALLELISM_KEY = "LATENT_SOURCE_PARALLELISM";

    private final ObjectMapper mapper;

    public PipelineConfigLoader() {
        this(new ObjectMapper());
    }

    public PipelineConfigLoader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * Resolve configuration from file/classpath and environment, then validate it.
     */
    public PipelineConfig load() {
        String path = Env.get(CONFIG_PATH_KEY, null);
        PipelineConfig base;
        if (path != null) {
            log.info("Loading pipeline config from {}", path);
            base = fromFile(Path.of(path));
        } else {
            base = fromClasspath(DEFAULT_RESOURCE);
        }
        return applyOverrides(base).validate();
    }

    public PipelineConfig fromFile(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            return fromStream(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read pipeline config " + path, e);
        }
    }

    public PipelineConfig fromClasspath(String resource) {
        try (InputStream in = PipelineConfigLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                log.info("No {} on classpath, using defaults", resource);
                return PipelineConfig.defaults();
            }
            log.info("Loading pipeline config from classpath:{}", resource);
            return fromStream(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read pipeline config resource " + resource, e);
        }
    }

    public PipelineConfig fromStream(InputStream in) throws IOException {
        JsonNode overrides = mapper.readTree(in);
        JsonNode merged = mapper.valueToTree(PipelineConfig.defaults());
        if (overrides != null && overrides.isObject()) {
            merge((ObjectNode) merged, (ObjectNode) overrides);
        } else if (overrides != null && !overrides.isMissingNode()) {
            throw new IllegalArgumentException("Pipeline config must be a JSON object");
        }
        return mapper.treeToValue(merged, PipelineConfig.class);
    }

    PipelineConfig applyOverrides(PipelineConfig config) {
        PipelineConfig result = config;

        long seed = Env.getLong(SEED_KEY, config.clustering().seed());
        if (seed != config.clustering().seed()) {
            log.info("Clustering seed overridden: {}", seed);
            result = result.withClustering(result.clustering().withSeed(seed));
        }

        double threshold = Env.getDouble(THRESHOLD_KEY, config.trading().threshold());
        int stride = Env.getInt(STRIDE_KEY, config.trading().stride());
        if (threshold != config.trading().threshold() || stride != config.trading().stride()) {
            log.info("Trading config overridden: threshold={}, stride={}", threshold, stride);
            result = result.withTrading(new TradingConfig(threshold, stride));
        }

        int parallelism = Env.getInt(PARALLELISM_KEY, config.parallelism());
        if (parallelism != config.parallelism()) {
            log.info("Parallelism overridden: {}", parallelism);
            result = result.withParallelism(parallelism);
        }
        return result;
    }

    private static void merge(ObjectNode target, ObjectNode source) {
        Iterator<Map.Entry<String, JsonNode>> fields = source.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode existing = target.get(field.getKey());
            if (existing != null && existing.isObject() && field.getValue().isObject()) {
                merge((ObjectNode) existing, (ObjectNode) field.getValue());
            } else {
                target.set(field.getKey(), field.getValue());
            }
        }
    }
}
