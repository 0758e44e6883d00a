/**
 * Analysis session lifecycle: states, failures and the finalized session record.
 */
package ca.siteguard.domain.session;
