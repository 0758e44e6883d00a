/** System clock adapter. */
package ca.siteguard.infrastructure.time;
