/**
 * Backend tiers, cost classes and per-call outcomes.
 */
package ca.siteguard.domain.backend;
