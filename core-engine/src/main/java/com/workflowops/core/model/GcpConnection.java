package com.workflowops.core.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * Service-account credentials a task uses to reach Google Cloud Storage.
 *
 * <p>
 * The values are opaque: the private key fields hold secret <em>names</em>
 * that the payload builder turns into secret references, never key material
 * that this library interprets. Any field may be {@code null}.
 * </p>
 *
 * @since 1.0.0
 */
public final class GcpConnection implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String projectId;
    private final String serviceAccountEmail;
    private final String serviceAccountPrivateKey;
    private final String serviceAccountPrivateKeyId;

    public GcpConnection(String projectId,
                         String serviceAccountEmail,
                         String serviceAccountPrivateKey,
                         String serviceAccountPrivateKeyId) {
        this.projectId = projectId;
        this.serviceAccountEmail = serviceAccountEmail;
        this.serviceAccountPrivateKey = serviceAccountPrivateKey;
        this.serviceAccountPrivateKeyId = serviceAccountPrivateKeyId;
    }

    public String getProjectId() {
        return projectId;
    }

    public String getServiceAccountEmail() {
        return serviceAccountEmail;
    }

    public String getServiceAccountPrivateKey() {
        return serviceAccountPrivateKey;
    }

    public String getServiceAccountPrivateKeyId() {
        return serviceAccountPrivateKeyId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof GcpConnection that))
            return false;
        return Objects.equals(projectId, that.projectId)
                && Objects.equals(serviceAccountEmail, that.serviceAccountEmail)
                && Objects.equals(serviceAccountPrivateKey, that.serviceAccountPrivateKey)
                && Objects.equals(serviceAccountPrivateKeyId, that.serviceAccountPrivateKeyId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(projectId, serviceAccountEmail, serviceAccountPrivateKey, serviceAccountPrivateKeyId);
    }

    // Private key names stay out of logs.
    @Override
    public String toString() {
        return "GcpConnection{" +
                "projectId='" + projectId + '\'' +
                ", serviceAccountEmail='" + serviceAccountEmail + '\'' +
                '}';
    }
}
