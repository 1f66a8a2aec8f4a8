package com.cmsadmin.cli.commands;

import com.cmsadmin.config.AdminConfig;
import com.cmsadmin.config.AdminConfigLoader;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Mixin for commands that read the service configuration.
 */
public class ConfigOption {

    @Option(
        names = {"-c", "--config"},
        description = "JSON configuration file (default: bundled " + AdminConfigLoader.DEFAULT_RESOURCE + ")"
    )
    Path configFile;

    AdminConfig load() throws IOException {
        return configFile == null ? AdminConfigLoader.loadDefault() : AdminConfigLoader.load(configFile);
    }
}
