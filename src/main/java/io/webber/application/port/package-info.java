/**
 * <strong>Purpose:</strong> Ports consumed by the build pipeline.
 * <p><strong>Pipeline role:</strong> Domain-facing contracts for network fetch, archive writing, clocks and
 * metrics; implemented under {@code io.webber.infrastructure}.
 * <p><strong>Concurrency:</strong> See individual ports.
 *
 * @since 0.1.0
 */
package io.webber.application.port;
