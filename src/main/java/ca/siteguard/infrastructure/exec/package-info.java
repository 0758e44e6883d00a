/** Thread pool factories for analysis work. */
package ca.siteguard.infrastructure.exec;
