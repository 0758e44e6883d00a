/**
 * Argument validation helpers shared by records, loaders and configuration.
 */
package ca.siteguard.validation;
