/**
 * Value types describing the outer click container.
 *
 * @since 0.1.0
 */
package io.webber.domain.archive;
