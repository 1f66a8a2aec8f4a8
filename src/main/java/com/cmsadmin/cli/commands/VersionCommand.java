package com.cmsadmin.cli.commands;

import picocli.CommandLine.Command;

import java.util.concurrent.Callable;

/**
 * Displays version information about cms-admin and its runtime.
 */
@Command(name = "version", description = "Show version information")
public class VersionCommand implements Callable<Integer> {

    @Override
    public Integer call() {
        System.out.println("cms-admin - contest management admin front end");
        System.out.println();
        System.out.println("Version: 1.0-SNAPSHOT");
        System.out.println("Java: " + System.getProperty("java.version"));
        System.out.println("OS: " + System.getProperty("os.name") + " " + System.getProperty("os.version"));
        System.out.println();
        System.out.println("Components:");
        System.out.println("  - RPC transport: RMI (Java)");
        System.out.println("  - CLI: Picocli 4.7.5");
        System.out.println("  - Configuration: Jackson 2.15");
        System.out.println("  - Logging: SLF4J + Logback");
        System.out.println();
        return 0;
    }
}
