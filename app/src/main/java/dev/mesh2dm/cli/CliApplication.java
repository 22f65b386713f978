package dev.mesh2dm.cli;

import dev.mesh2dm.config.Config;
import dev.mesh2dm.config.ConfigLoader;
import dev.mesh2dm.config.SystemEnvironmentReader;
import dev.mesh2dm.logging.LoggingConfigurator;
import dev.mesh2dm.mesh.Extent;
import dev.mesh2dm.mesh.Mesh;
import dev.mesh2dm.mesh.MeshReadException;
import dev.mesh2dm.mesh.MeshReader;
import dev.mesh2dm.write.MeshWriter;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * Entry point wiring the command-line parser, configuration loader, mesh reader and writer.
 */
public final class CliApplication {

    static final int EXIT_MESH_ERROR = 1;

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);
    private static final String SIGNATURE = "Written by mesh2dm";

    private final ConfigLoader configLoader;

    public CliApplication() {
        this(new ConfigLoader(new SystemEnvironmentReader()));
    }

    CliApplication(ConfigLoader configLoader) {
        this.configLoader = configLoader;
    }

    public static void main(String[] args) {
        System.exit(new CliApplication().run(args));
    }

    public int run(String[] args) {
        CliArguments cliArguments = new CliArguments();
        CommandLine commandLine = new CommandLine(cliArguments);

        try {
            commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException ex) {
            commandLine.getErr().println(ex.getMessage());
            commandLine.usage(commandLine.getErr());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }

        if (commandLine.isUsageHelpRequested()) {
            commandLine.usage(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }
        if (commandLine.isVersionHelpRequested()) {
            commandLine.printVersionHelp(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnVersionHelp();
        }

        Config config;
        try {
            config = configLoader.load(cliArguments);
        } catch (IllegalArgumentException ex) {
            commandLine.getErr().println(ex.getMessage());
            commandLine.usage(commandLine.getErr());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }
        LoggingConfigurator.configure(config.logFormat(), config.verbose());
        LOGGER.debug("Parse options: {}, writer options: {}", config.parseOptions(), config.writerOptions());

        Path meshPath = config.meshPath();
        try {
            Mesh mesh = new MeshReader(config.parseOptions()).read(meshPath);
            logSummary(meshPath, mesh);
            if (config.outputPath().isPresent()) {
                Path output = config.outputPath().get();
                new MeshWriter(config.writerOptions()).write(output, mesh, SIGNATURE);
                LOGGER.info("Wrote mesh to {}", output);
            }
            return 0;
        } catch (MeshReadException ex) {
            LOGGER.error("Invalid mesh: {}", ex.getMessage());
            return EXIT_MESH_ERROR;
        } catch (UncheckedIOException ex) {
            LOGGER.error("{}", ex.getMessage(), ex.getCause());
            return EXIT_MESH_ERROR;
        }
    }

    private void logSummary(Path meshPath, Mesh mesh) {
        LOGGER.info("Mesh '{}' ({}): {} nodes, {} elements, {} node strings, {} materials per element",
                mesh.name(), meshPath, mesh.nodes().size(), mesh.elements().size(), mesh.nodeStrings().size(),
                mesh.materialsPerElement());
        Extent extent = mesh.extent();
        if (!extent.isEmpty()) {
            LOGGER.info("Extent: x [{}, {}], y [{}, {}]", extent.minX(), extent.maxX(), extent.minY(), extent.maxY());
        }
        if (!mesh.skippedCards().isEmpty()) {
            LOGGER.warn("Unsupported cards skipped: {}", mesh.skippedCards());
        }
    }
}
