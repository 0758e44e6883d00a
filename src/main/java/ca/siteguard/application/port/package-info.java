/**
 * Ports between the analysis core and its adapters: backends, inference engines, connectivity, persistence,
 * clock and metrics.
 */
package ca.siteguard.application.port;
