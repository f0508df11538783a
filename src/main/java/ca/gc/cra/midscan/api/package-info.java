/**
 * CLI entry points for the MIDSCAN resolve, mailboxes and providers commands.
 * <p><strong>Role:</strong> Adapter layer on the driving side; parses arguments, configures logging, and invokes
 * use cases.</p>
 * <p><strong>Concurrency:</strong> Commands run single-threaded.</p>
 * <p><strong>Security:</strong> Passwords come from the environment or a console prompt and are cleared after
 * login; they never reach configuration maps or logs.</p>
 */
package ca.gc.cra.midscan.api;
