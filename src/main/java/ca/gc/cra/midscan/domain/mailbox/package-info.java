/**
 * Mailbox descriptors and the ordered, duplicate-free scan plan walked for each identifier.
 */
package ca.gc.cra.midscan.domain.mailbox;
