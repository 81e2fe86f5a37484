package io.llmops.platform.runtime.role;

import io.llmops.platform.runtime.config.AppDescriptor;
import io.llmops.platform.runtime.config.ConfigException;
import io.llmops.platform.runtime.config.RoleConfig;
import io.llmops.platform.runtime.registry.Role;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * The web front end, served by gunicorn (flask) or streamlit depending on
 * the descriptor's {@code web_server}.
 */
public class WebRole extends ApplicationRole {

    static final String DEFAULT_WEB_SERVER = "flask";
    static final String DEFAULT_APP_MODULE = "app:app";
    static final String DEFAULT_APP_FILE = "app.py";

    public WebRole(@Nonnull RoleContext context) {
        super(Role.WEB, context);
    }

    @Nonnull
    @Override
    protected LaunchPlan plan(@Nonnull RoleConfig config, @Nonnull AppDescriptor descriptor) throws ConfigException {
        String webServer = descriptor.getString("web", "web_server", DEFAULT_WEB_SERVER).trim().toLowerCase(Locale.ROOT);
        int port = config.getPort();

        switch (webServer) {
            case "flask": {
                String module = descriptor.getString("web", "app_module", DEFAULT_APP_MODULE);
                return new LaunchPlan(
                        List.of("gunicorn", "-b", "0.0.0.0:" + port, module),
                        Map.of(),
                        Map.of("web_server", webServer, "app_module", module));
            }
            case "streamlit": {
                String appFile = descriptor.getString("web", "app_file", DEFAULT_APP_FILE);
                String appPath = config.getApplicationDirectory().resolve(appFile).toString();
                return new LaunchPlan(
                        List.of("streamlit", "run", appPath, "--server.port", String.valueOf(port)),
                        Map.of(),
                        Map.of("web_server", webServer, "app_file", appPath));
            }
            default:
                throw ConfigException.invalid("web_server",
                        "unsupported web server '" + webServer + "', expected flask or streamlit");
        }
    }
}
