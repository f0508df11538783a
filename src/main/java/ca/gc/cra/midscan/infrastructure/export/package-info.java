/**
 * File export adapters (CSV and newline-delimited JSON).
 */
package ca.gc.cra.midscan.infrastructure.export;
