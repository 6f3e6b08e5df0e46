/**
 * <strong>Purpose:</strong> Archive adapters for the tarball and container ports.
 * <p><strong>Pipeline role:</strong> Infrastructure; invoked by the build use case after staging.
 * <p><strong>Concurrency:</strong> Stateless apart from the injected clock; safe to share.
 *
 * @since 0.1.0
 */
package io.webber.infrastructure.archive;
