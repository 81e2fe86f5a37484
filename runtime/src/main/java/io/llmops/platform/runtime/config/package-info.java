/**
 * Role configuration: loading {@code <role>_server.json}, interpolating
 * {@code ${APP_DIR}} and environment references, and validating the
 * role-specific sections.
 */
package io.llmops.platform.runtime.config;
