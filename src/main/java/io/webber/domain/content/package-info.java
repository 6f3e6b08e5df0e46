/**
 * <strong>Purpose:</strong> Pure generators for every metadata, policy and launcher file in a click package.
 * <p><strong>Pipeline role:</strong> Domain layer; called by the build use case while staging.
 * <p><strong>Concurrency:</strong> Stateless and deterministic.
 *
 * @since 0.1.0
 */
package io.webber.domain.content;
