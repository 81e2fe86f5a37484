package io.llmops.platform.runtime.role;

import javax.annotation.Nonnull;
import java.util.List;

/**
 * Renders the reverse proxy site: an upstream block over the eligible
 * backends and a server block forwarding {@code /api/} and {@code /} to it.
 */
final class NginxConfig {

    static final String UPSTREAM = "backend";

    private static final String[] LOCATIONS = {"/api/", "/"};

    private NginxConfig() {
    }

    /**
     * Render the site configuration.
     *
     * @param servers upstream servers, {@code host:port}
     * @param port listen port
     * @return nginx configuration text
     */
    @Nonnull
    static String render(@Nonnull List<String> servers, int port) {
        if (servers.isEmpty()) {
            throw new IllegalArgumentException("an upstream needs at least one server");
        }
        StringBuilder out = new StringBuilder();
        out.append("upstream ").append(UPSTREAM).append(" {\n");
        for (String server : servers) {
            out.append("    server ").append(server).append(";\n");
        }
        out.append("}\n\n");

        out.append("server {\n");
        out.append("    listen ").append(port).append(";\n");
        for (String location : LOCATIONS) {
            out.append('\n');
            out.append("    location ").append(location).append(" {\n");
            out.append("        proxy_pass http://").append(UPSTREAM).append(";\n");
            out.append("        proxy_set_header Host $host;\n");
            out.append("        proxy_set_header X-Real-IP $remote_addr;\n");
            out.append("        proxy_set_header X-Forwarded-For $proxy_add_x_forwarded_for;\n");
            out.append("        proxy_set_header X-Forwarded-Proto $scheme;\n");
            out.append("    }\n");
        }
        out.append("}\n");
        return out.toString();
    }
}
