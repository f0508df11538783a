/**
 * Ports connecting the resolution engine to mail sessions, exporters, metrics and clocks.
 * <p><strong>Role:</strong> Boundary interfaces of the hexagonal architecture; adapters live under
 * {@code ca.gc.cra.midscan.infrastructure}.</p>
 * <p><strong>Concurrency:</strong> Session ports are single-threaded by contract.</p>
 */
package ca.gc.cra.midscan.application.port;
