package io.llmops.platform.runtime.role;

import org.junit.jupiter.api.Test;
import org.yaml.snakeyaml.Yaml;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class PrometheusConfigTest {

    @Test
    @SuppressWarnings("unchecked")
    void scrapesEveryTargetUnderOneJob() {
        String yaml = PrometheusConfig.render(List.of("localhost:8000", "localhost:8080"));

        Map<String, Object> root = new Yaml().load(yaml);
        assertThat((Map<String, Object>) root.get("global"))
                .containsEntry("scrape_interval", "15s")
                .containsEntry("evaluation_interval", "15s");

        List<Map<String, Object>> jobs = (List<Map<String, Object>>) root.get("scrape_configs");
        assertThat(jobs).singleElement().satisfies(job -> {
            assertThat(job).containsEntry("job_name", "llm_platform");
            List<Map<String, Object>> staticConfigs = (List<Map<String, Object>>) job.get("static_configs");
            assertThat(staticConfigs.get(0)).containsEntry("targets", List.of("localhost:8000", "localhost:8080"));
        });
    }

    @Test
    void writesBlockStyle() {
        String yaml = PrometheusConfig.render(List.of("localhost:9100"));

        assertThat(yaml).startsWith("global:\n  scrape_interval: 15s\n").doesNotContain("{");
    }
}
