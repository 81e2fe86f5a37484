/**
 * Role lifecycles: one {@link io.llmops.platform.runtime.role.RoleLifecycle}
 * per {@link io.llmops.platform.runtime.registry.Role}, looked up through
 * {@link io.llmops.platform.runtime.role.RoleLifecycles}.
 *
 * <p>Every start records an undo for each OS resource it creates in a
 * {@link io.llmops.platform.runtime.role.StartRollback}, so a failed start
 * leaves nothing behind.</p>
 */
package io.llmops.platform.runtime.role;
