/**
 * Command-line entry points for SiteGuard.
 * <p><strong>Role:</strong> Parses {@code key=value} arguments, merges configuration and prints results.
 * User-facing output goes through {@link ca.siteguard.api.CliPrinter}; diagnostics go to SLF4J.</p>
 */
package ca.siteguard.api;
