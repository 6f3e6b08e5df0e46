/**
 * <strong>Purpose:</strong> Logging utilities for verbosity control and bounded log values.
 * <p><strong>Concurrency:</strong> Stateless helpers.
 * <p><strong>Observability:</strong> Coordinates with SLF4J/Logback; no metrics.
 *
 * @since 0.1.0
 */
package io.webber.logging;
