/**
 * <strong>Purpose:</strong> Command-line front end: {@code webber build} and {@code webber identify}.
 * <p><strong>Pipeline role:</strong> Parses {@code key=value} settings and switches, layers them over
 * YAML and defaults, runs the build and maps its failures to {@link io.webber.api.ExitCode}s.
 * <p><strong>Concurrency:</strong> Single-threaded CLI bootstrap.
 *
 * @since 0.1.0
 */
package io.webber.api;
