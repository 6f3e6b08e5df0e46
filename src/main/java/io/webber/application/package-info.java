/**
 * Application layer: ports and the build pipeline.
 *
 * @since 0.1.0
 */
package io.webber.application;
