/**
 * OS handles of role instances: processes, service units and activation
 * markers, plus the records that let separate invocations find them again.
 */
package io.llmops.platform.runtime.process;
