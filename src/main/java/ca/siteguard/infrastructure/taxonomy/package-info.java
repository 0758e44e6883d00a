/**
 * Loads the hazard taxonomy from YAML with SnakeYAML.
 */
package ca.siteguard.infrastructure.taxonomy;
