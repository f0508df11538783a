/**
 * Input validation helpers shared by configuration and CLI parsing.
 */
package ca.gc.cra.midscan.validation;
