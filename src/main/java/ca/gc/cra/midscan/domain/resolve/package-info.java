/**
 * Search tiers and resolution outcomes.
 */
package ca.gc.cra.midscan.domain.resolve;
