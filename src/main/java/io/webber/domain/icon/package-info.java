/**
 * Icon source selection for click packages.
 *
 * @since 0.1.0
 */
package io.webber.domain.icon;
