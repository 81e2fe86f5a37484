/**
 * Public API of the LLM Ops server runtime.
 *
 * <p>Lets embedding code and external collaborators (routing layer,
 * dashboards, scripts) start, stop and inspect server roles without
 * depending on the runtime's internals.</p>
 *
 * @see io.llmops.platform.api.runtime.ServerRuntimeAPI
 */
package io.llmops.platform.api.runtime;
