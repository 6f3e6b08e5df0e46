/**
 * Time source adapters.
 *
 * @since 0.1.0
 */
package io.webber.infrastructure.time;
