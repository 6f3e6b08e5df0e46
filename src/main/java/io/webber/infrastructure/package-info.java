/**
 * Adapters implementing the application ports: archives, network, metrics and time.
 *
 * @since 0.1.0
 */
package io.webber.infrastructure;
