package com.workflowops.planner;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.workflowops.core.payload.ClusterSpecResolver;
import com.workflowops.core.payload.PayloadException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * Reads cluster specs from JSON files.
 *
 * <p>
 * A {@code cluster_config_path} is resolved against the base directory
 * first and, when no such file exists, looked up as a classpath resource.
 * </p>
 *
 * @since 1.0.0
 */
public class JsonFileClusterSpecResolver implements ClusterSpecResolver {

    private static final Logger LOG = LoggerFactory.getLogger(JsonFileClusterSpecResolver.class);

    private static final TypeReference<Map<String, Object>> SPEC_TYPE = new TypeReference<>() {
    };

    private final Path baseDir;
    private final ObjectMapper mapper;

    public JsonFileClusterSpecResolver(Path baseDir, ObjectMapper mapper) {
        this.baseDir = Objects.requireNonNull(baseDir, "baseDir must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    @Override
    public Map<String, Object> resolve(String clusterConfigPath) {
        Path file = baseDir.resolve(clusterConfigPath);
        try {
            if (Files.isRegularFile(file)) {
                LOG.debug("Reading cluster spec from {}", file);
                return mapper.readValue(file.toFile(), SPEC_TYPE);
            }
            InputStream is = JsonFileClusterSpecResolver.class.getClassLoader().getResourceAsStream(clusterConfigPath);
            if (is == null) {
                throw new PayloadException("Cluster spec not found: " + clusterConfigPath + " (looked in " + baseDir
                        + " and on the classpath)");
            }
            try (is) {
                LOG.debug("Reading cluster spec from classpath: {}", clusterConfigPath);
                return mapper.readValue(is, SPEC_TYPE);
            }
        } catch (IOException e) {
            throw new PayloadException("Failed to read cluster spec " + clusterConfigPath + ": " + e.getMessage(), e);
        }
    }
}
