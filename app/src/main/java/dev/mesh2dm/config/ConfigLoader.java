package dev.mesh2dm.config;

import dev.mesh2dm.cli.CliArguments;
import dev.mesh2dm.parse.ParseOptions;
import dev.mesh2dm.write.WriterOptions;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds a {@link Config} by combining CLI arguments with environment variables and defaults.
 * CLI values win over the environment.
 */
public class ConfigLoader {

    static final String ENV_ZERO_INDEX = "MESH2D_ZERO_INDEX";
    static final String ENV_ALLOW_FLOAT_MATID = "MESH2D_ALLOW_FLOAT_MATID";
    static final String ENV_DECIMALS = "MESH2D_DECIMALS";
    static final String ENV_NODES_PER_LINE = "MESH2D_NODES_PER_LINE";
    static final String ENV_LOG_FORMAT = "LOG_FORMAT";

    private final EnvironmentReader environmentReader;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
    }

    public Config load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");
        if (arguments.meshPath() == null) {
            throw new IllegalArgumentException("mesh file must be provided");
        }

        boolean zeroIndex = arguments.zeroIndex() || resolveFlag(ENV_ZERO_INDEX, false);
        boolean allowFloatMatid = !arguments.noFloatMatid() && resolveFlag(ENV_ALLOW_FLOAT_MATID, true);
        int decimals = Optional.ofNullable(arguments.decimals())
                .orElseGet(() -> resolveInteger(ENV_DECIMALS, WriterOptions.DEFAULT_DECIMALS));
        int nodesPerLine = resolveInteger(ENV_NODES_PER_LINE, WriterOptions.DEFAULT_NODES_PER_LINE);

        ParseOptions parseOptions = new ParseOptions(zeroIndex, allowFloatMatid);
        WriterOptions writerOptions = new WriterOptions(decimals, arguments.compact(), allowFloatMatid, nodesPerLine);

        return new Config(arguments.meshPath(), Optional.ofNullable(arguments.outputPath()),
                parseOptions, writerOptions, resolveLogFormat(arguments), arguments.verbose());
    }

    private LogFormat resolveLogFormat(CliArguments arguments) {
        LogFormat cliFormat = arguments.logFormat();
        if (cliFormat != null) {
            return cliFormat;
        }
        return environmentReader.get(ENV_LOG_FORMAT)
                .filter(ConfigLoader::isNotBlank)
                .map(LogFormat::from)
                .orElse(LogFormat.TEXT);
    }

    private boolean resolveFlag(String key, boolean defaultValue) {
        return environmentReader.get(key)
                .filter(ConfigLoader::isNotBlank)
                .map(String::trim)
                .map(value -> parseFlag(key, value))
                .orElse(defaultValue);
    }

    private int resolveInteger(String key, int defaultValue) {
        return environmentReader.get(key)
                .filter(ConfigLoader::isNotBlank)
                .map(String::trim)
                .map(value -> parseNonNegativeInteger(key, value))
                .orElse(defaultValue);
    }

    private static boolean parseFlag(String key, String raw) {
        if (raw.equalsIgnoreCase("true") || raw.equals("1")) {
            return true;
        }
        if (raw.equalsIgnoreCase("false") || raw.equals("0")) {
            return false;
        }
        throw new IllegalArgumentException(key + " must be true, false, 1 or 0");
    }

    private static int parseNonNegativeInteger(String key, String raw) {
        try {
            int value = Integer.parseInt(raw);
            if (value < 0) {
                throw new IllegalArgumentException(key + " must be zero or greater");
            }
            return value;
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(key + " must be an integer", ex);
        }
    }

    private static boolean isNotBlank(String value) {
        return value != null && !value.isBlank();
    }
}
