/**
 * Logging utilities: verbosity control for the CLI and redaction helpers for remote payloads and credentials.
 *
 * @since SiteGuard 0.1
 */
package ca.siteguard.logging;
