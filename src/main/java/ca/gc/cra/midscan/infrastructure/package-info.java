/**
 * Adapters implementing the application ports against IMAP, files, MIME parsing and OpenTelemetry.
 */
package ca.gc.cra.midscan.infrastructure;
