package com.workflowops.core.model;

import java.io.Serializable;
import java.util.Objects;
import java.util.Optional;

/**
 * A library a task installs on its cluster before running.
 *
 * <p>
 * Exactly one of two forms:
 * </p>
 * <ul>
 * <li>{@link Kind#WHL}: a remote wheel archive, e.g.
 * {@code {whl: "s3://bucket/tools-0.0.4-py3-none-any.whl"}}</li>
 * <li>{@link Kind#PYPI}: a package-registry reference, e.g.
 * {@code {pypi: {package: "google-cloud-bigquery==1.25.0"}}} with an
 * optional {@code repo} index URL</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class LibraryRef implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Descriptor keys of the two library forms. */
    public enum Kind {
        WHL("whl"),
        PYPI("pypi");

        private final String key;

        Kind(String key) {
            this.key = key;
        }

        /**
         * @return the descriptor key introducing this form
         */
        public String key() {
            return key;
        }
    }

    private final Kind kind;
    private final String location;
    private final String pypiPackage;
    private final String repo;

    private LibraryRef(Kind kind, String location, String pypiPackage, String repo) {
        this.kind = kind;
        this.location = location;
        this.pypiPackage = pypiPackage;
        this.repo = repo;
    }

    /**
     * @param location archive URI; must not be {@code null}
     * @return a wheel reference
     */
    public static LibraryRef whl(String location) {
        return new LibraryRef(Kind.WHL, Objects.requireNonNull(location, "location must not be null"), null, null);
    }

    /**
     * @param pypiPackage requirement spec, e.g. {@code name==1.0}; must not be
     *                    {@code null}
     * @param repo        optional index URL; may be {@code null}
     * @return a package-registry reference
     */
    public static LibraryRef pypi(String pypiPackage, String repo) {
        return new LibraryRef(Kind.PYPI, null,
                Objects.requireNonNull(pypiPackage, "package must not be null"), repo);
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * @return the archive URI of a {@link Kind#WHL} reference
     */
    public Optional<String> getLocation() {
        return Optional.ofNullable(location);
    }

    /**
     * @return the requirement spec of a {@link Kind#PYPI} reference
     */
    public Optional<String> getPackage() {
        return Optional.ofNullable(pypiPackage);
    }

    public Optional<String> getRepo() {
        return Optional.ofNullable(repo);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof LibraryRef that))
            return false;
        return kind == that.kind
                && Objects.equals(location, that.location)
                && Objects.equals(pypiPackage, that.pypiPackage)
                && Objects.equals(repo, that.repo);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, location, pypiPackage, repo);
    }

    @Override
    public String toString() {
        return kind == Kind.WHL
                ? "LibraryRef{whl='" + location + "'}"
                : "LibraryRef{pypi='" + pypiPackage + "'" + (repo != null ? ", repo='" + repo + "'" : "") + '}';
    }
}
