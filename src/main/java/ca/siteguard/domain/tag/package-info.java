/**
 * Compliance tags, the hazard taxonomy and tag recommendations.
 */
package ca.siteguard.domain.tag;
