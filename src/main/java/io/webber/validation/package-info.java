/**
 * <strong>Purpose:</strong> Checks applied to settings before they reach the build pipeline.
 * <p><strong>Security:</strong> Rejects multi-line values and staging roots that are unsafe to wipe.
 *
 * @since 0.1.0
 */
package io.webber.validation;
