/**
 * Hazard types, severities, categories, detections and fused hazards.
 * <p>Regions are normalized to the unit square so detections from different input resolutions compare
 * directly.</p>
 */
package ca.siteguard.domain.hazard;
