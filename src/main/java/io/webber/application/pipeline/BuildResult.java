package io.webber.application.pipeline;

import io.webber.domain.pkg.AppIdentifier;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Outcome of a successful build.
 *
 * @param identifier derived application identifier
 * @param packageFile finished {@code shortcut.click} container
 * @param iconFileName icon file staged under {@code data/}
 * @since 0.1.0
 */
public record BuildResult(AppIdentifier identifier, Path packageFile, String iconFileName) {
  public BuildResult {
    Objects.requireNonNull(identifier, "identifier");
    Objects.requireNonNull(packageFile, "packageFile");
    Objects.requireNonNull(iconFileName, "iconFileName");
  }
}
