package it.unimib.datai.runinator.console.commands;

import it.unimib.datai.runinator.console.testsupport.CliTestSupport;
import it.unimib.datai.runinator.console.testsupport.GossipSender;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class RootCommandTest {

    @TempDir
    Path tmp;

    @Test
    void helpPrintsUsage() {
        RootCommand cmd = new RootCommand();
        CommandLine cli = new CommandLine(cmd);

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        cli.setOut(new PrintWriter(out, true));

        int exit = cli.execute("--help");

        assertThat(exit).isEqualTo(0);
        assertThat(out.toString()).contains("Usage:").contains("tasks").contains("discover");
    }

    @Test
    void configOptionLoadsFromCustomPath() throws Exception {
        Path cfgPath = tmp.resolve("console.yaml");
        Files.writeString(cfgPath, """
                currentContext: lab
                contexts:
                  lab:
                    gossipBind: 0.0.0.0
                    gossipPort: "6000"
                    requestTimeoutSeconds: 7
                """);

        RootCommand cmd = new RootCommand();
        CommandLine cli = new CommandLine(cmd);
        cli.parseArgs("--config", cfgPath.toString(), "tasks", "list");

        assertThat(cmd.resolvedContext().contextName()).isEqualTo("lab");
        assertThat(cmd.resolvedContext().gossipBind()).isEqualTo("0.0.0.0");
        assertThat(cmd.resolvedContext().gossipPort()).isEqualTo(6000);
        assertThat(cmd.resolvedContext().requestTimeout()).isEqualTo(Duration.ofSeconds(7));
        assertThat(cmd.resolvedContext().usesDiscovery()).isTrue();
    }

    @Test
    void optionsOverrideConfig() throws Exception {
        Path cfgPath = tmp.resolve("console.yaml");
        Files.writeString(cfgPath, """
                currentContext: lab
                contexts:
                  lab:
                    gossipBind: 0.0.0.0
                    gossipPort: "6000"
                """);

        RootCommand cmd = new RootCommand();
        CommandLine cli = new CommandLine(cmd);
        cli.parseArgs("--config", cfgPath.toString(),
                "--gossip-bind", "127.0.0.1", "--gossip-port", "7001",
                "--endpoint", "http://localhost:9999",
                "tasks", "list");

        assertThat(cmd.resolvedContext().gossipBind()).isEqualTo("127.0.0.1");
        assertThat(cmd.resolvedContext().gossipPort()).isEqualTo(7001);
        assertThat(cmd.resolvedContext().endpoint()).isEqualTo("http://localhost:9999");
        assertThat(cmd.resolvedContext().usesDiscovery()).isFalse();
    }

    @Test
    void invalidPortOptionFallsBack() {
        RootCommand cmd = new RootCommand();
        CommandLine cli = new CommandLine(cmd);
        cli.parseArgs("--config", tmp.resolve("missing.yaml").toString(), "--gossip-port", "not-a-port", "discover");

        assertThat(cmd.resolvedContext().gossipPort()).isEqualTo(5000);
    }

    @Test
    void commandWithoutAnnouncementTimesOut() throws Exception {
        int port = GossipSender.freeUdpPort();
        try (RootCommand cmd = new RootCommand()) {
            CommandLine cli = new CommandLine(cmd);

            CliTestSupport.CommandResult result = CliTestSupport.execute(cli,
                    "--config", tmp.resolve("missing.yaml").toString(),
                    "--gossip-bind", "127.0.0.1", "--gossip-port", Integer.toString(port),
                    "--discovery-timeout", "1",
                    "tasks", "list");

            assertThat(result.exitCode()).isNotEqualTo(0);
            assertThat(result.stderr()).contains("No backend discovered within 1s");
        }
    }

    @Test
    void gossipBindFailureExitsNonZero() {
        try (RootCommand cmd = new RootCommand()) {
            CommandLine cli = new CommandLine(cmd);

            CliTestSupport.CommandResult result = CliTestSupport.execute(cli,
                    "--config", tmp.resolve("missing.yaml").toString(),
                    "--gossip-bind", "203.0.113.1",
                    "discover");

            assertThat(result.exitCode()).isNotEqualTo(0);
            assertThat(result.stderr()).contains("Failed to bind gossip socket");
        }
    }
}
