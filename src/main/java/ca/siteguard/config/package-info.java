/**
 * Configuration loading, merging and object-graph wiring for SiteGuard.
 * <p>Precedence is CLI over YAML over built-in defaults; validation happens in
 * {@link ca.siteguard.config.AnalysisConfig#fromMap(java.util.Map)}.</p>
 */
package ca.siteguard.config;
