/**
 * Search tiers: query model, wire rendering, attempt execution and the header and time-window tiers.
 */
package ca.gc.cra.midscan.application.search;
