/**
 * IMAP session adapter built on Jakarta Mail and the Eclipse Angus provider.
 */
package ca.gc.cra.midscan.infrastructure.imap;
