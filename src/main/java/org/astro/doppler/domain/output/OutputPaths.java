package org.astro.doppler.domain.output;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.astro.doppler.util.PathUtils;

/**
 * <strong>What:</strong> Derives output and figure paths from input spectrum paths.
 * <p>The base name is the input file name without its last extension. The directory is chosen as:
 * <ol>
 *   <li>the configured output directory, when present;</li>
 *   <li>otherwise the input's own parent directory, when it has one;</li>
 *   <li>otherwise none, leaving a bare file name relative to the working directory.</li>
 * </ol>
 * Explicit paths supplied by the user are returned unchanged.</p>
 *
 * @since 0.1.0
 */
public final class OutputPaths {
  private final Optional<Path> outputDirectory;

  /**
   * @param outputDirectory optional directory overriding every derived location
   */
  public OutputPaths(Optional<Path> outputDirectory) {
    this.outputDirectory = Objects.requireNonNull(outputDirectory, "outputDirectory");
  }

  /**
   * Derives the path of {@code kind} for {@code input}.
   *
   * @param input input spectrum path
   * @param kind artifact to name
   * @return derived path
   */
  public Path derive(Path input, ArtifactKind kind) {
    Objects.requireNonNull(kind, "kind");
    String name = PathUtils.baseName(input) + kind.suffix();
    if (outputDirectory.isPresent()) {
      return outputDirectory.get().resolve(name);
    }
    Path parent = input.getParent();
    return parent != null ? parent.resolve(name) : Path.of(name);
  }

  /** Individual-mode output path: explicit when given, else derived from {@code input}. */
  public Path individualOutput(Path input, Optional<Path> explicit) {
    return explicit.orElseGet(() -> derive(input, ArtifactKind.INDIVIDUAL_OUTPUT));
  }

  /**
   * Individual-mode figure path: explicit when given, else derived when plotting, else none.
   *
   * @param input input spectrum path
   * @param explicit user-supplied figure path
   * @param plot whether plots were requested
   * @return figure path handed to the engine, if any
   */
  public Optional<Path> individualFigure(Path input, Optional<Path> explicit, boolean plot) {
    if (explicit.isPresent()) {
      return explicit;
    }
    return plot ? Optional.of(derive(input, ArtifactKind.INDIVIDUAL_FIGURE)) : Optional.empty();
  }

  /** Joint output path: explicit when given, else derived from the first input. */
  public Path jointOutput(List<Path> inputs, Optional<Path> explicit) {
    return explicit.orElseGet(() -> derive(first(inputs), ArtifactKind.JOINT_OUTPUT));
  }

  /** Combined diagnostic document: explicit when given, else derived from the first input. */
  public Path combinedDocument(List<Path> inputs, Optional<Path> explicit) {
    return explicit.orElseGet(() -> derive(first(inputs), ArtifactKind.COMBINED_DOCUMENT));
  }

  private static Path first(List<Path> inputs) {
    if (inputs.isEmpty()) {
      throw new IllegalArgumentException("at least one input path is required");
    }
    return inputs.get(0);
  }
}
