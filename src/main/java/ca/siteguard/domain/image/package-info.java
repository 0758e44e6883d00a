/**
 * Submitted images, capture metadata and request context.
 */
package ca.siteguard.domain.image;
