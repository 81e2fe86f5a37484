package io.llmops.platform.runtime.role;

import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;

import javax.annotation.Nonnull;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders the metrics collector's {@code prometheus.yml}.
 */
final class PrometheusConfig {

    static final String JOB_NAME = "llm_platform";
    static final String SCRAPE_INTERVAL = "15s";

    private PrometheusConfig() {
    }

    /**
     * Render a configuration scraping every target under one job.
     *
     * @param targets scrape targets, {@code host:port}
     * @return YAML text
     */
    @Nonnull
    static String render(@Nonnull List<String> targets) {
        Map<String, Object> global = new LinkedHashMap<>();
        global.put("scrape_interval", SCRAPE_INTERVAL);
        global.put("evaluation_interval", SCRAPE_INTERVAL);

        Map<String, Object> job = new LinkedHashMap<>();
        job.put("job_name", JOB_NAME);
        job.put("static_configs", List.of(Map.of("targets", List.copyOf(targets))));

        Map<String, Object> root = new LinkedHashMap<>();
        root.put("global", global);
        root.put("scrape_configs", List.of(job));

        DumperOptions options = new DumperOptions();
        options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        options.setIndent(2);
        options.setPrettyFlow(true);
        return new Yaml(options).dump(root);
    }
}
