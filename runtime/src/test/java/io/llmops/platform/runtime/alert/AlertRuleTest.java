package io.llmops.platform.runtime.alert;

import io.llmops.platform.runtime.config.ConfigException;
import io.llmops.platform.runtime.config.ConfigStore;
import io.llmops.platform.runtime.config.JsonMappers;
import io.llmops.platform.runtime.config.RoleConfig;
import io.llmops.platform.runtime.registry.Role;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class AlertRuleTest {

    @TempDir
    Path appDir;

    private List<AlertRule> rules(String alertRules) throws ConfigException {
        ConfigStore store = new ConfigStore(appDir, appDir, Map.of(), JsonMappers.create());
        RoleConfig config = store.parse(Role.MONITORING, "{\"alert_rules\": " + alertRules + "}",
                appDir.resolve("monitoring_server.json"));
        return AlertRule.parseAll(config.getAlertRules());
    }

    @Test
    void durationThresholdIsInSeconds() throws ConfigException {
        AlertRule rule = rules("{\"high_latency\": {\"threshold\": \"0.5s\", \"duration\": \"5m\"}}").get(0);

        assertThat(rule.name()).isEqualTo("high_latency");
        assertThat(rule.metric()).hasToString("high_latency");
        assertThat(rule.totalMetric()).isNull();
        assertThat(rule.kind()).isEqualTo(AlertRule.Kind.VALUE);
        assertThat(rule.threshold()).isCloseTo(0.5, within(1e-9));
        assertThat(rule.duration()).isEqualTo(Duration.ofMinutes(5));
    }

    @Test
    void percentageThresholdIsAFraction() throws ConfigException {
        AlertRule rule = rules("{\"error_rate\": {\"threshold\": \"5%\", \"duration\": \"1m\"}}").get(0);

        assertThat(rule.kind()).isEqualTo(AlertRule.Kind.PERCENTAGE);
        assertThat(rule.threshold()).isCloseTo(0.05, within(1e-9));
        assertThat(rule.describeThreshold()).isEqualTo("> 5.0%");
        assertThat(rule.metric()).hasToString(AlertRule.DEFAULT_FAILED_METRIC);
        assertThat(rule.totalMetric()).hasToString(AlertRule.DEFAULT_TOTAL_METRIC);
    }

    @Test
    void percentageCountersCanBeSelected() throws ConfigException {
        AlertRule rule = rules("{\"error_rate\": {\"threshold\": \"2%\", \"duration\": \"5m\","
                + " \"metric\": \"http_requests_total{status=\\\"500\\\"}\","
                + " \"total_metric\": \"http_requests_total\"}}").get(0);

        assertThat(rule.metric().name()).isEqualTo("http_requests_total");
        assertThat(rule.metric().labels()).containsExactly(Map.entry("status", "500"));
        assertThat(rule.totalMetric().labels()).isEmpty();
    }

    @Test
    void rejectsMalformedSelector() {
        assertThatThrownBy(() -> rules("{\"x\": {\"threshold\": \"1\", \"duration\": \"1m\","
                + " \"metric\": \"latency{route=/predict}\"}}"))
                .isInstanceOf(ConfigException.class)
                .hasMessageStartingWith("alert_rules.x.metric:");
    }

    @Test
    void ruleNameMustBeAMetricNameWhenNoMetricIsGiven() {
        assertThatThrownBy(() -> rules("{\"high-latency\": {\"threshold\": \"0.5s\", \"duration\": \"1m\"}}"))
                .isInstanceOf(ConfigException.class)
                .hasMessageStartingWith("alert_rules.high-latency.metric:");
    }

    @Test
    void totalMetricOnlyAppliesToPercentages() {
        assertThatThrownBy(() -> rules("{\"x\": {\"threshold\": \"1\", \"duration\": \"1m\","
                + " \"total_metric\": \"http_requests_total\"}}"))
                .isInstanceOf(ConfigException.class)
                .hasMessageStartingWith("alert_rules.x.total_metric:");
    }

    @Test
    void plainNumberAndExplicitMetric() throws ConfigException {
        AlertRule rule = rules("{\"queue\": {\"threshold\": \"100\", \"duration\": \"0s\", \"metric\": \"queue_depth\"}}").get(0);

        assertThat(rule.kind()).isEqualTo(AlertRule.Kind.VALUE);
        assertThat(rule.metric()).hasToString("queue_depth");
        assertThat(rule.threshold()).isEqualTo(100.0);
        assertThat(rule.duration()).isZero();
    }

    @Test
    void keepsDocumentOrder() throws ConfigException {
        List<AlertRule> rules = rules("{\"b\": {\"threshold\": \"1\", \"duration\": \"1s\"},"
                + " \"a\": {\"threshold\": \"2\", \"duration\": \"1s\"}}");

        assertThat(rules).extracting(AlertRule::name).containsExactly("b", "a");
    }

    @Test
    void rejectsUnparseableThreshold() {
        assertThatThrownBy(() -> rules("{\"x\": {\"threshold\": \"high\", \"duration\": \"1m\"}}"))
                .isInstanceOf(ConfigException.class)
                .hasMessageStartingWith("alert_rules.x.threshold:");
    }

    @Test
    void rejectsPercentageAboveHundred() {
        assertThatThrownBy(() -> rules("{\"x\": {\"threshold\": \"150%\", \"duration\": \"1m\"}}"))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("0..100");
    }

    @Test
    void durationIsRequired() {
        assertThatThrownBy(() -> rules("{\"x\": {\"threshold\": \"1\"}}"))
                .isInstanceOf(ConfigException.class)
                .hasMessageStartingWith("alert_rules.x.duration:");
    }

    @Test
    void atLeastOneRule() {
        assertThatThrownBy(() -> rules("{}"))
                .isInstanceOf(ConfigException.class)
                .hasMessageStartingWith("alert_rules:");
    }
}
