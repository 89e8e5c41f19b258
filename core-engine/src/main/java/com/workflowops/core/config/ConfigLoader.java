package com.workflowops.core.config;

import com.workflowops.core.model.JobDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Loads and validates workflow descriptors.
 *
 * <h3>Pipeline</h3>
 * <ol>
 * <li>Compose the YAML and expand {@code <<} merge keys, nested mappings
 * merged key-wise ({@link DefaultsMerger}).</li>
 * <li>Select the jobs: top-level entries whose key starts with the job key
 * prefix. Other entries, such as the anchored {@code default-settings}
 * block, are fragments and are dropped after merging.</li>
 * <li>Bind each job and its tasks; shape errors and missing required keys
 * raise {@link ConfigParseException}.</li>
 * <li>Validate names, schedules, libraries and the dependency graph. All
 * violations are collected and raised together as a
 * {@link ConfigValidationException}.</li>
 * </ol>
 *
 * <p>
 * Loading is all-or-nothing: a document with any invalid job yields no
 * result. Loading has no side effects besides logging, and instances are
 * immutable, so one loader can serve concurrent callers.
 * </p>
 *
 * <h3>Sources</h3>
 * <ol>
 * <li>Environment variable {@value #ENV_CONFIG_PATH} (file system path)</li>
 * <li>Explicit file system path passed to {@link #fromFile(String)}</li>
 * <li>Classpath resource via {@link #fromClasspath(String)}</li>
 * </ol>
 *
 * @since 1.0.0
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    /** Environment variable that can override the default descriptor location. */
    public static final String ENV_CONFIG_PATH = "WORKFLOW_CONFIG_PATH";

    /** Classpath resource used when no path is configured. */
    public static final String DEFAULT_RESOURCE = "job_config.yaml";

    /** Top-level keys starting with this prefix declare jobs. */
    public static final String DEFAULT_JOB_KEY_PREFIX = "workflow";

    private final String jobKeyPrefix;

    public ConfigLoader() {
        this(DEFAULT_JOB_KEY_PREFIX);
    }

    /**
     * @param jobKeyPrefix prefix identifying job entries; an empty prefix makes
     *                     every top-level entry a job
     */
    public ConfigLoader(String jobKeyPrefix) {
        this.jobKeyPrefix = Objects.requireNonNull(jobKeyPrefix, "jobKeyPrefix must not be null");
    }

    public String getJobKeyPrefix() {
        return jobKeyPrefix;
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Parse and validate a descriptor.
     *
     * @param source descriptor text; must not be {@code null}
     * @return every job of the document, in declaration order
     * @throws ConfigParseException      if the document is malformed
     * @throws ConfigValidationException if any job breaks a semantic rule
     */
    public WorkflowConfig load(String source) {
        Objects.requireNonNull(source, "Descriptor source must not be null");

        Object root = new MergingYamlReader().read(source);
        if (root == null) {
            throw new ConfigParseException("", "descriptor is empty");
        }
        Map<String, Object> document = DescriptorBinder.requireMapping(root, "", "descriptor");

        List<Violation> violations = new ArrayList<>();
        DescriptorBinder binder = new DescriptorBinder(violations);
        List<DescriptorBinder.JobDraft> drafts = new ArrayList<>();
        document.forEach((key, body) -> {
            if (key.startsWith(jobKeyPrefix)) {
                drafts.add(binder.bindJob(key, body));
            } else {
                LOG.debug("Skipping top-level entry '{}': not a job", key);
            }
        });

        DescriptorValidator validator = new DescriptorValidator(violations);
        validator.checkJobNames(drafts);
        List<JobDefinition> jobs = new ArrayList<>();
        for (DescriptorBinder.JobDraft draft : drafts) {
            Optional<List<String>> order = validator.validate(draft);
            order.ifPresent(o -> jobs.add(new JobDefinition(draft.key, draft.jobName, draft.schedule, draft.tasks, o)));
        }

        if (!violations.isEmpty()) {
            LOG.error("Workflow descriptor rejected with {} violation(s)", violations.size());
            throw new ConfigValidationException(violations);
        }
        if (jobs.isEmpty()) {
            LOG.warn("No jobs with key prefix '{}' defined in descriptor", jobKeyPrefix);
        }

        LOG.info("Loaded {} job(s)", jobs.size());
        return new WorkflowConfig(jobs);
    }

    /**
     * Parse and validate a descriptor that declares exactly one job.
     *
     * @param source descriptor text; must not be {@code null}
     * @return the single job
     * @throws ConfigParseException      if the document is malformed or does
     *                                   not declare exactly one job
     * @throws ConfigValidationException if the job breaks a semantic rule
     */
    public JobDefinition loadJob(String source) {
        WorkflowConfig config = load(source);
        if (config.size() != 1) {
            throw new ConfigParseException("",
                    "expected exactly one job, found " + config.size() + ": " + config.getJobKeys());
        }
        return config.getJobs().get(0);
    }

    /**
     * Load using automatic resolution.
     *
     * <ol>
     * <li>If {@code WORKFLOW_CONFIG_PATH} is set and the file exists, load from
     * there.</li>
     * <li>Otherwise, fall back to {@value #DEFAULT_RESOURCE} on the
     * classpath.</li>
     * </ol>
     *
     * @return parsed and validated descriptor
     */
    public WorkflowConfig fromDefaultLocation() {
        String envPath = System.getenv(ENV_CONFIG_PATH);
        if (envPath != null && !envPath.isBlank() && Files.exists(Path.of(envPath))) {
            LOG.info("Loading workflow descriptor from environment path: {}", envPath);
            return fromFile(envPath);
        }
        LOG.info("Loading workflow descriptor from classpath: {}", DEFAULT_RESOURCE);
        return fromClasspath(DEFAULT_RESOURCE);
    }

    /**
     * Load from a file system path.
     *
     * @param path absolute or relative path to the YAML file; must not be
     *             {@code null}
     * @return parsed and validated descriptor
     * @throws IllegalArgumentException  if the file does not exist
     * @throws IllegalStateException     if reading fails
     * @throws ConfigException           if the descriptor is invalid
     */
    public WorkflowConfig fromFile(String path) {
        Objects.requireNonNull(path, "Descriptor file path must not be null");
        String source;
        try {
            source = Files.readString(Path.of(path), StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            throw new IllegalArgumentException("Workflow descriptor not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read workflow descriptor: " + path, e);
        }
        return load(source);
    }

    /**
     * Load from a classpath resource.
     *
     * @param resource classpath resource name; must not be {@code null}
     * @return parsed and validated descriptor
     * @throws IllegalArgumentException if the resource does not exist
     * @throws IllegalStateException    if reading fails
     * @throws ConfigException          if the descriptor is invalid
     */
    public WorkflowConfig fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = ConfigLoader.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (is) {
            return load(new String(is.readAllBytes(), StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read classpath resource: " + resource, e);
        }
    }
}
