/**
 * Application-level pipeline that stages, archives and assembles a click package.
 * <p>{@link io.webber.application.pipeline.BuildPackageUseCase} runs every step in order on the
 * caller's thread and reports failures through
 * {@link io.webber.application.pipeline.PackageBuildException}; metrics flow through
 * {@link io.webber.application.port.MetricsPort}.</p>
 *
 * @since 0.1.0
 */
package io.webber.application.pipeline;
