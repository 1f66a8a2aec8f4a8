package com.cmsadmin.cli.commands;

import com.cmsadmin.config.AdminConfig;
import com.cmsadmin.service.ServiceAddress;
import com.cmsadmin.service.ServiceCoord;
import com.cmsadmin.service.UnknownServiceException;
import com.cmsadmin.storage.FileStorageClient;
import com.cmsadmin.storage.FileStorageServer;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Runs one FileStorage shard on the port configured for it.
 */
@Command(name = "storage", description = "Start a file storage shard")
public class StorageCommand implements Callable<Integer> {

    @Option(
        names = {"-s", "--shard"},
        description = "FileStorage shard to run (default: ${DEFAULT-VALUE})",
        defaultValue = "0"
    )
    int shard;

    @Option(
        names = {"-d", "--directory"},
        description = "Where content is stored (default: storage_directory from the configuration)"
    )
    Path directory;

    @Mixin
    ConfigOption config;

    @Override
    public Integer call() throws Exception {
        AdminConfig adminConfig = config.load();
        ServiceCoord coord = new ServiceCoord(FileStorageClient.SERVICE_NAME, shard);

        ServiceAddress address;
        try {
            address = adminConfig.getServiceRegistry().address(coord);
        } catch (UnknownServiceException e) {
            System.err.println("ERROR: " + e.getMessage());
            System.err.println("Add a " + FileStorageClient.SERVICE_NAME + " entry to \"core_services\"");
            return 1;
        }

        Path storageDirectory = directory != null ? directory : adminConfig.getStorageDirectory();
        FileStorageServer server = new FileStorageServer(coord, storageDirectory);
        Runtime.getRuntime().addShutdownHook(new Thread(server::shutdown, "FileStorage-shutdown"));
        server.start(address.getPort());

        System.out.println("[OK] FileStorage " + coord + " started");
        System.out.println("  Port: " + address.getPort());
        System.out.println("  Directory: " + storageDirectory.toAbsolutePath());
        System.out.println();
        System.out.println("Press Ctrl+C to stop");

        // Keep alive
        Thread.currentThread().join();
        return 0;
    }
}
