/**
 * <strong>Purpose:</strong> Configuration loading, precedence and wiring for the webber CLI.
 * <p><strong>Sources:</strong> embedded defaults, an optional YAML file ({@code common} plus a command
 * section) and CLI {@code key=value} arguments, merged with precedence CLI &gt; YAML &gt; defaults.
 * <p><strong>Concurrency:</strong> Configuration records are immutable.
 *
 * @since 0.1.0
 */
package io.webber.config;
