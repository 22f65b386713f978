package dev.mesh2dm.config;

import dev.mesh2dm.parse.ParseOptions;
import dev.mesh2dm.write.WriterOptions;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable runtime settings assembled from CLI arguments, environment values and defaults.
 */
public record Config(
        Path meshPath,
        Optional<Path> outputPath,
        ParseOptions parseOptions,
        WriterOptions writerOptions,
        LogFormat logFormat,
        boolean verbose
) {

    public Config {
        Objects.requireNonNull(meshPath, "meshPath");
        outputPath = outputPath == null ? Optional.empty() : outputPath;
        parseOptions = Objects.requireNonNull(parseOptions, "parseOptions");
        writerOptions = Objects.requireNonNull(writerOptions, "writerOptions");
        logFormat = logFormat == null ? LogFormat.TEXT : logFormat;
        if (outputPath.filter(meshPath::equals).isPresent()) {
            throw new IllegalArgumentException("--output must differ from the input mesh");
        }
        if (parseOptions.allowFloatMatid() != writerOptions.allowFloatMatid()) {
            throw new IllegalArgumentException("parse and writer options disagree on float material IDs");
        }
    }
}
