package com.cmsadmin.cli.commands;

import com.cmsadmin.config.AdminConfig;
import com.cmsadmin.notification.QuestionSource;
import com.cmsadmin.server.AdminService;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

import java.util.concurrent.Callable;

/**
 * Starts the admin service and keeps it running until the process is killed.
 */
@Command(name = "server", description = "Start the admin service")
public class ServerCommand implements Callable<Integer> {

    @Option(
        names = {"-s", "--shard"},
        description = "Shard index of this admin instance (default: ${DEFAULT-VALUE})",
        defaultValue = "0"
    )
    int shard;

    @Mixin
    ConfigOption config;

    @Override
    public Integer call() throws Exception {
        AdminConfig adminConfig = config.load();

        System.out.println("========================================");
        System.out.println("  cms-admin - Starting");
        System.out.println("========================================");
        System.out.println();

        AdminService service = new AdminService(shard, adminConfig, QuestionSource.NONE);
        Runtime.getRuntime().addShutdownHook(new Thread(service::shutdown, "AdminService-shutdown"));
        service.start();

        System.out.println("[OK] Admin service started");
        System.out.println("  Shard: " + shard);
        System.out.println("  Services: " + adminConfig.getServiceRegistry().serviceNames());
        System.out.println();
        System.out.println("Press Ctrl+C to stop");
        System.out.println();

        // Keep alive
        Thread.currentThread().join();
        return 0;
    }
}
