package com.cmsadmin.cli;

import ch.qos.logback.classic.Level;
import com.cmsadmin.cli.commands.ResourcesCommand;
import com.cmsadmin.cli.commands.ServerCommand;
import com.cmsadmin.cli.commands.StorageCommand;
import com.cmsadmin.cli.commands.VersionCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.concurrent.Callable;

/**
 * cms-admin CLI - main entry point and command dispatcher.
 *
 * Root command with global options and subcommands for running the admin
 * service, a file storage shard, and inspecting the configuration.
 */
@Command(
    name = "cms-admin",
    description = "Contest management admin front end",
    version = "cms-admin 1.0-SNAPSHOT",
    mixinStandardHelpOptions = true,
    subcommands = {
        ServerCommand.class,
        StorageCommand.class,
        ResourcesCommand.class,
        VersionCommand.class
    }
)
public class AdminCli implements Callable<Integer> { // Callable<Integer> to return the exit code

    static final String PROJECT_LOGGER = "com.cmsadmin";

    private boolean verbose;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new AdminCli()).execute(args);
        System.exit(exitCode);
    }

    /**
     * Global option, applied as soon as it is parsed so subcommands log at DEBUG too.
     */
    @Option(
        names = {"-v", "--verbose"},
        description = "Enable verbose output (DEBUG logging)"
    )
    void setVerbose(boolean verbose) {
        this.verbose = verbose;
        if (verbose) {
            // logback.xml sets the project logger level explicitly
            setDebug(LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME));
            setDebug(LoggerFactory.getLogger(PROJECT_LOGGER));
        }
    }

    private static void setDebug(Logger logger) {
        if (logger instanceof ch.qos.logback.classic.Logger) {
            ((ch.qos.logback.classic.Logger) logger).setLevel(Level.DEBUG);
        }
    }

    @Override
    public Integer call() {
        // If no subcommand is provided, show help
        new CommandLine(this).usage(System.out);
        return 0;
    }

    public boolean isVerbose() {
        return verbose;
    }
}
