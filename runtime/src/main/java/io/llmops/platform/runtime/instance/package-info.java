/**
 * Role instances and their lifecycle.
 */
package io.llmops.platform.runtime.instance;
