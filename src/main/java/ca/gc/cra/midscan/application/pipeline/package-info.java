/**
 * Batch resolution pipeline: scan planning, mailbox orchestration and result aggregation.
 */
package ca.gc.cra.midscan.application.pipeline;
