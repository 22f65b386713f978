package dev.mesh2dm.cli;

import dev.mesh2dm.config.LogFormat;
import java.nio.file.Path;
import picocli.CommandLine;

@CommandLine.Command(name = "mesh2dm", mixinStandardHelpOptions = true, version = "mesh2dm 0.1.0",
        description = "Validate a 2DM mesh file, print a summary and optionally rewrite it")
public class CliArguments {

    @CommandLine.Parameters(index = "0", arity = "0..1", description = "2DM mesh file to read", paramLabel = "MESH")
    private Path meshPath;

    @CommandLine.Option(names = {"-o", "--output"}, description = "Write the parsed mesh to this file", paramLabel = "FILE")
    private Path outputPath;

    @CommandLine.Option(names = "--zero-index", description = "Accept 0 as a node and element ID")
    private boolean zeroIndex;

    @CommandLine.Option(names = "--no-float-matid", description = "Reject floating point material IDs")
    private boolean noFloatMatid;

    @CommandLine.Option(names = "--compact", description = "Write coordinates as plain decimals instead of scientific notation")
    private boolean compact;

    @CommandLine.Option(names = "--decimals", description = "Digits after the decimal point for written coordinates", paramLabel = "COUNT")
    private Integer decimals;

    @CommandLine.Option(names = "--log-format", description = "Log format: text or json", converter = LogFormatConverter.class)
    private LogFormat logFormat;

    @CommandLine.Option(names = {"-v", "--verbose"}, description = "Log skipped cards and other details")
    private boolean verbose;

    public Path meshPath() {
        return meshPath;
    }

    public Path outputPath() {
        return outputPath;
    }

    public boolean zeroIndex() {
        return zeroIndex;
    }

    public boolean noFloatMatid() {
        return noFloatMatid;
    }

    public boolean compact() {
        return compact;
    }

    public Integer decimals() {
        return decimals;
    }

    public LogFormat logFormat() {
        return logFormat;
    }

    public boolean verbose() {
        return verbose;
    }
}
