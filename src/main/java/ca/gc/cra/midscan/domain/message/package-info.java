/**
 * Identifier normalization, embedded timestamp extraction and header snapshots.
 */
package ca.gc.cra.midscan.domain.message;
