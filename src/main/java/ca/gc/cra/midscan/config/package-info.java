/**
 * Configuration records, provider directory and composition root wiring for MIDSCAN commands.
 * <p><strong>Role:</strong> Application bootstrap layer; merges defaults, YAML and CLI values and selects
 * adapters.</p>
 * <p><strong>Concurrency:</strong> Configuration objects are immutable; safe to share.</p>
 * <p><strong>Security:</strong> Passwords never pass through these maps; see {@code ca.gc.cra.midscan.api}.</p>
 */
package ca.gc.cra.midscan.config;
