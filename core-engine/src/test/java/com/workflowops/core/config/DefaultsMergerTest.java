package com.workflowops.core.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link DefaultsMerger}.
 */
class DefaultsMergerTest {

    @Test
    @DisplayName("Should keep defaults that are not overridden")
    void shouldKeepDefaults() {
        Map<String, Object> merged = DefaultsMerger.merge(
                Map.of("tasktype", "notebook"),
                Map.of("task_name", "api"));

        assertThat(merged).containsEntry("tasktype", "notebook").containsEntry("task_name", "api");
    }

    @Test
    @DisplayName("Should let a local scalar win")
    void shouldPreferLocalScalar() {
        Map<String, Object> merged = DefaultsMerger.merge(
                Map.of("tasktype", "notebook"),
                Map.of("tasktype", "sql"));

        assertThat(merged).containsEntry("tasktype", "sql");
    }

    @Test
    @DisplayName("Should merge nested mappings key by key")
    void shouldMergeNestedMappings() {
        Map<String, Object> merged = DefaultsMerger.merge(
                Map.of("gcp_connection", Map.of("project_id", "shared", "service_account_email", "a@example.com")),
                Map.of("gcp_connection", Map.of("project_id", "local")));

        assertThat(merged.get("gcp_connection")).isEqualTo(
                Map.of("project_id", "local", "service_account_email", "a@example.com"));
    }

    @Test
    @DisplayName("Should replace lists wholesale")
    void shouldReplaceLists() {
        Map<String, Object> merged = DefaultsMerger.merge(
                Map.of("email_on_failure", List.of("a@example.com", "b@example.com")),
                Map.of("email_on_failure", List.of("c@example.com")));

        assertThat(merged.get("email_on_failure")).isEqualTo(List.of("c@example.com"));
    }

    @Test
    @DisplayName("Should let an explicit local null clear a default")
    void shouldPreferLocalNull() {
        Map<String, Object> local = new HashMap<>();
        local.put("cluster_config_path", null);

        Map<String, Object> merged = DefaultsMerger.merge(Map.of("cluster_config_path", "clusters/a.json"), local);

        assertThat(merged).containsEntry("cluster_config_path", null);
    }

    @Test
    @DisplayName("Should not modify its inputs")
    void shouldNotModifyInputs() {
        Map<String, Object> defaults = new HashMap<>(Map.of("a", 1));
        Map<String, Object> overrides = new HashMap<>(Map.of("b", 2));

        DefaultsMerger.merge(defaults, overrides);

        assertThat(defaults).containsOnlyKeys("a");
        assertThat(overrides).containsOnlyKeys("b");
    }

    @Test
    @DisplayName("Should reject non-string keys in merged mappings")
    void shouldRejectNonStringKeys() {
        assertThatThrownBy(() -> DefaultsMerger.merge(
                Map.of("nested", Map.of(1, "x")),
                Map.of("nested", Map.of(2, "y"))))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
