package com.cmsadmin.cli.commands;

import com.cmsadmin.config.AdminConfig;
import com.cmsadmin.server.AdminService;
import com.cmsadmin.service.ServiceCoord;
import com.cmsadmin.service.ServiceRegistry;
import com.cmsadmin.service.UnknownServiceException;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

import java.util.concurrent.Callable;

/**
 * Lists the ResourceService shards and where they run.
 */
@Command(name = "resources", description = "List ResourceService shards and their addresses")
public class ResourcesCommand implements Callable<Integer> {

    @Mixin
    ConfigOption config;

    @Override
    public Integer call() throws Exception {
        AdminConfig adminConfig = config.load();
        ServiceRegistry registry = adminConfig.getServiceRegistry();

        int shards;
        try {
            shards = registry.shardCount(AdminService.RESOURCE_SERVICE);
        } catch (UnknownServiceException e) {
            System.err.println("ERROR: " + e.getMessage());
            return 1;
        }

        System.out.println(AdminService.RESOURCE_SERVICE + ": " + shards + " shard(s)");
        for (int shard = 0; shard < shards; shard++) {
            System.out.println("  [" + shard + "] " + registry.address(new ServiceCoord(AdminService.RESOURCE_SERVICE, shard)));
        }
        return 0;
    }
}
