package io.llmops.platform.runtime.role;

import io.llmops.platform.runtime.config.AppDescriptor;
import io.llmops.platform.runtime.config.RoleConfig;
import io.llmops.platform.runtime.registry.Role;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * The model inference API. FastAPI modules run under uvicorn, anything
 * else under gunicorn; the model location is exported as {@code MODEL_PATH}.
 */
public class InferenceApiRole extends ApplicationRole {

    static final String DEFAULT_API_MODULE = "api:app";
    static final String DEFAULT_MODEL_PATH = "model";
    static final int DEFAULT_WORKERS = 2;

    public InferenceApiRole(@Nonnull RoleContext context) {
        super(Role.API, context);
    }

    @Nonnull
    @Override
    protected LaunchPlan plan(@Nonnull RoleConfig config, @Nonnull AppDescriptor descriptor) {
        String module = descriptor.getString("api", "api_module", DEFAULT_API_MODULE);
        String modelPath = config.getApplicationDirectory()
                .resolve(descriptor.getString("model", "model_path", DEFAULT_MODEL_PATH))
                .toString();
        String port = String.valueOf(config.getPort());
        String workers = String.valueOf(config.getWorkers(DEFAULT_WORKERS));

        List<String> command;
        if (module.toLowerCase(Locale.ROOT).contains("fastapi")) {
            command = List.of("uvicorn", module, "--host", "0.0.0.0", "--port", port, "--workers", workers);
        } else {
            command = List.of("gunicorn", "-b", "0.0.0.0:" + port, "-w", workers, module);
        }
        return new LaunchPlan(command,
                Map.of("MODEL_PATH", modelPath),
                Map.of("api_module", module, "MODEL_PATH", modelPath, "workers", workers));
    }
}
