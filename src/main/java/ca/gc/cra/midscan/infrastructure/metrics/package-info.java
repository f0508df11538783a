/**
 * OpenTelemetry-backed implementation of the metrics port.
 */
package ca.gc.cra.midscan.infrastructure.metrics;
