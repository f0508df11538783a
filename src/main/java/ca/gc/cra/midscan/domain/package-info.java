/**
 * Core domain model for Message-ID resolution: identifiers, mailboxes, scan plans and outcomes.
 * <p><strong>Role:</strong> Domain layer types with no infrastructure dependencies.</p>
 * <p><strong>Concurrency:</strong> Types are immutable; safe to share across threads.</p>
 */
package ca.gc.cra.midscan.domain;
