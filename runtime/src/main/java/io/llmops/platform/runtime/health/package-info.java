/**
 * Backend health checking for the load balancer role.
 */
package io.llmops.platform.runtime.health;
