package com.workflowops.planner;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Local directory holding recorded deployment state.
 *
 * <h3>Layout</h3>
 *
 * <pre>
 * &lt;root&gt;/current_state.json
 * &lt;root&gt;/historic_state/state_file_&lt;version&gt;.json
 * </pre>
 *
 * <p>
 * Each snapshot is written to the history first and then to
 * {@code current_state.json}, so the current file never names a version that
 * has no history entry. I/O failures surface as
 * {@link UncheckedIOException}.
 * </p>
 *
 * @since 1.0.0
 */
public class StateStore {

    private static final Logger LOG = LoggerFactory.getLogger(StateStore.class);

    public static final String CURRENT_STATE_FILE = "current_state.json";
    public static final String HISTORIC_DIR = "historic_state";
    static final String HISTORIC_PREFIX = "state_file_";
    static final String HISTORIC_SUFFIX = ".json";

    private final Path root;
    private final ObjectMapper mapper;

    public StateStore(Path root, ObjectMapper mapper) {
        this.root = Objects.requireNonNull(root, "root must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    public Path getRoot() {
        return root;
    }

    /**
     * @return the current snapshot, or empty if none has been recorded
     * @throws UncheckedIOException if the file exists but cannot be read
     */
    public Optional<StateSnapshot> readCurrent() {
        Path current = root.resolve(CURRENT_STATE_FILE);
        if (!Files.exists(current)) {
            LOG.info("No current state at {}", current);
            return Optional.empty();
        }
        try {
            StateSnapshot snapshot = mapper.readValue(current.toFile(), StateSnapshot.class);
            LOG.info("Read current state version {} with {} job(s)", snapshot.getVersion(),
                    snapshot.getConfig().size());
            return Optional.of(snapshot);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read state file: " + current, e);
        }
    }

    /**
     * Record {@code config} as the next version after the current one.
     *
     * @param config    job settings with {@code job_id}, keyed by job key
     * @param timestamp recording time
     * @return the written snapshot
     */
    public StateSnapshot record(Map<String, Map<String, Object>> config, LocalDateTime timestamp) {
        String previous = readCurrent().map(StateSnapshot::getVersion).orElse(null);
        String version = StateVersion.next(previous);
        LOG.debug("Advancing state version {} -> {}", previous, version);
        StateSnapshot snapshot = new StateSnapshot(new StateSnapshot.Metadata(version, timestamp), config);
        write(snapshot);
        return snapshot;
    }

    /**
     * Write {@code snapshot} to the history and make it current.
     *
     * @return path of the history entry
     * @throws UncheckedIOException if writing fails
     */
    public Path write(StateSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot must not be null");
        Path historic = historicFile(snapshot.getVersion());
        Path current = root.resolve(CURRENT_STATE_FILE);
        try {
            Files.createDirectories(historic.getParent());
            mapper.writeValue(historic.toFile(), snapshot);
            LOG.info("Wrote state history {}", historic);
            mapper.writeValue(current.toFile(), snapshot);
            LOG.info("Updated current state {} to version {}", current, snapshot.getVersion());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write state version " + snapshot.getVersion(), e);
        }
        return historic;
    }

    /**
     * @return versions present in the history, oldest first
     */
    public List<String> listVersions() {
        Path dir = root.resolve(HISTORIC_DIR);
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        List<String> versions = new ArrayList<>();
        try (Stream<Path> files = Files.list(dir)) {
            files.map(p -> p.getFileName().toString())
                    .filter(name -> name.startsWith(HISTORIC_PREFIX) && name.endsWith(HISTORIC_SUFFIX))
                    .map(name -> name.substring(HISTORIC_PREFIX.length(), name.length() - HISTORIC_SUFFIX.length()))
                    .filter(StateVersion::isValid)
                    .forEach(versions::add);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list state history in " + dir, e);
        }
        versions.sort(StateVersion.ORDER);
        return versions;
    }

    /**
     * @return the history entry preceding the latest one, or empty when fewer
     *         than two versions are recorded
     */
    public Optional<Path> previousVersionFile() {
        List<String> versions = listVersions();
        if (versions.size() < 2) {
            return Optional.empty();
        }
        return Optional.of(historicFile(versions.get(versions.size() - 2)));
    }

    Path historicFile(String version) {
        return root.resolve(HISTORIC_DIR).resolve(HISTORIC_PREFIX + version + HISTORIC_SUFFIX);
    }
}
