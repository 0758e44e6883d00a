/**
 * File-backed persistence of backend health snapshots.
 */
package ca.siteguard.infrastructure.health;
