/**
 * Identifier input loading.
 */
package ca.gc.cra.midscan.infrastructure.input;
