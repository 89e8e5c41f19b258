package com.workflowops.core.payload;

import com.workflowops.core.model.GcpConnection;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Spark settings that let a cluster read and write Google Cloud Storage with
 * a task's service account.
 *
 * <p>
 * Private keys never appear in the payload: their names are rendered as
 * secret references, {@code {{secrets/<scope>/<name>}}}, resolved by the
 * cluster at start-up. Absent connection fields are left out.
 * </p>
 */
final class GcpSparkConf {

    static final String SPARK_CONF = "spark_conf";

    private GcpSparkConf() {
    }

    static Map<String, Object> settings(GcpConnection connection, String secretScope) {
        Map<String, Object> conf = new LinkedHashMap<>();
        conf.put("spark.hadoop.google.cloud.auth.service.account.enable", "true");
        putIfPresent(conf, "spark.hadoop.fs.gs.auth.service.account.email", connection.getServiceAccountEmail());
        putIfPresent(conf, "spark.hadoop.fs.gs.project.id", connection.getProjectId());
        putIfPresent(conf, "spark.hadoop.fs.gs.auth.service.account.private.key",
                secretReference(secretScope, connection.getServiceAccountPrivateKey()));
        putIfPresent(conf, "spark.hadoop.fs.gs.auth.service.account.private.key.id",
                secretReference(secretScope, connection.getServiceAccountPrivateKeyId()));
        return conf;
    }

    /**
     * Adds the GCS settings to {@code clusterSpec.spark_conf}, creating it when
     * missing. Existing entries with the same keys are overwritten.
     */
    static void apply(Map<String, Object> clusterSpec, GcpConnection connection, String secretScope) {
        Object existing = clusterSpec.get(SPARK_CONF);
        Map<String, Object> sparkConf = new LinkedHashMap<>();
        if (existing instanceof Map<?, ?> entries) {
            entries.forEach((key, value) -> {
                if (!(key instanceof String name)) {
                    throw new PayloadException("Cluster spec 'spark_conf' keys must be strings, found: " + key);
                }
                sparkConf.put(name, value);
            });
        } else if (existing != null) {
            throw new PayloadException("Cluster spec 'spark_conf' must be an object, found: " + existing);
        }
        sparkConf.putAll(settings(connection, secretScope));
        clusterSpec.put(SPARK_CONF, sparkConf);
    }

    static String secretReference(String scope, String name) {
        return name == null ? null : "{{secrets/" + scope + "/" + name + "}}";
    }

    private static void putIfPresent(Map<String, Object> map, String key, String value) {
        if (value != null) {
            map.put(key, value);
        }
    }
}
