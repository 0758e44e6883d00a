/**
 * {@code AnalyzerBackend} adapters.
 * <p>Local adapters wrap host-supplied inference engines; the remote adapter talks JSON over HTTPS. Adapters
 * report failures as {@code BackendOutcome} values and never throw for engine or network errors.</p>
 */
package ca.siteguard.infrastructure.backend;
