/**
 * Logging helpers on top of SLF4J and Logback.
 */
package ca.gc.cra.midscan.logging;
