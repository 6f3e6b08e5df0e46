/**
 * webber: builds click packages that open a web site in a web app container.
 *
 * @since 0.1.0
 */
package io.webber;
