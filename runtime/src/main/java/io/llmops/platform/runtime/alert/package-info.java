/**
 * Threshold and duration alert evaluation for the monitoring role.
 *
 * <p>Rules come from the {@code alert_rules} section of the monitoring config.
 * A threshold is a plain number, a duration compared in seconds ({@code 0.5s})
 * or a percentage of failed samples ({@code 5%}).</p>
 */
package io.llmops.platform.runtime.alert;
