package com.cmsadmin.cli;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import com.cmsadmin.rpc.RpcChannel;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class AdminCliTest {

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private PrintStream originalOut;

    @BeforeEach
    void captureOutput() {
        originalOut = System.out;
        System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void restoreOutput() {
        System.setOut(originalOut);
    }

    private int run(String... args) {
        return new CommandLine(new AdminCli()).execute(args);
    }

    @Test
    void resourcesListsEveryShard(@TempDir Path dir) throws Exception {
        Path config = dir.resolve("admin.json");
        Files.writeString(config, "{\"core_services\": {\"ResourceService\": "
            + "[[\"10.0.0.1\", 28000], [\"10.0.0.2\", 28001]]}}");

        int exitCode = run("resources", "--config", config.toString());

        assertThat(exitCode).isZero();
        assertThat(out.toString(StandardCharsets.UTF_8))
            .contains("ResourceService: 2 shard(s)")
            .contains("[0] 10.0.0.1:28000")
            .contains("[1] 10.0.0.2:28001");
    }

    @Test
    void resourcesFailsWithoutResourceService(@TempDir Path dir) throws Exception {
        Path config = dir.resolve("admin.json");
        Files.writeString(config, "{\"core_services\": {\"LogService\": [[\"localhost\", 29000]]}}");

        assertThat(run("resources", "-c", config.toString())).isEqualTo(1);
    }

    @Test
    void resourcesUsesTheBundledConfigurationByDefault() {
        assertThat(run("resources")).isZero();
        assertThat(out.toString(StandardCharsets.UTF_8)).contains("ResourceService: 1 shard(s)");
    }

    @Test
    void verboseEnablesDebugLoggingForProjectClasses() throws Exception {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        configure(context, "logback.xml");
        try {
            Logger channelLog = LoggerFactory.getLogger(RpcChannel.class);
            assertThat(channelLog.isDebugEnabled()).isFalse();

            AdminCli cli = new AdminCli();
            assertThat(new CommandLine(cli).execute("--verbose", "version")).isZero();

            assertThat(cli.isVerbose()).isTrue();
            assertThat(channelLog.isDebugEnabled()).isTrue();
            assertThat(out.toString(StandardCharsets.UTF_8)).contains("cms-admin");
        } finally {
            configure(context, "logback-test.xml");
        }
    }

    @Test
    void withoutVerboseProductionLoggingStaysAtInfo() throws Exception {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        configure(context, "logback.xml");
        try {
            assertThat(run("version")).isZero();

            assertThat(LoggerFactory.getLogger(RpcChannel.class).isDebugEnabled()).isFalse();
            assertThat(LoggerFactory.getLogger(RpcChannel.class).isInfoEnabled()).isTrue();
        } finally {
            configure(context, "logback-test.xml");
        }
    }

    private static void configure(LoggerContext context, String resource) throws JoranException {
        context.reset();
        JoranConfigurator configurator = new JoranConfigurator();
        configurator.setContext(context);
        configurator.doConfigure(AdminCliTest.class.getClassLoader().getResource(resource));
    }
}
