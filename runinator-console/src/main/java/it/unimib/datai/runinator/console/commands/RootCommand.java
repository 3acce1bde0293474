package it.unimib.datai.runinator.console.commands;

import it.unimib.datai.runinator.console.ConsoleException;
import it.unimib.datai.runinator.console.FailureKind;
import it.unimib.datai.runinator.console.commands.tasks.TasksCommand;
import it.unimib.datai.runinator.console.config.ConfigStore;
import it.unimib.datai.runinator.console.config.GossipDefaults;
import it.unimib.datai.runinator.console.config.ResolvedContext;
import it.unimib.datai.runinator.console.session.ConsoleListener;
import it.unimib.datai.runinator.console.session.ConsoleSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

@Command(
        name = "runinator",
        mixinStandardHelpOptions = true,
        description = "Runinator operator console (gossip discovery + task API client).",
        subcommands = {
                DiscoverCommand.class,
                TasksCommand.class
        }
)
public class RootCommand implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(RootCommand.class);

    @Option(names = {"--config"}, description = "Path to config file (default: ~/.config/runinator/console.yaml).")
    Path configPath;

    @Option(names = {"--endpoint"}, description = "Web service base URL; skips gossip discovery (overrides config/env).")
    String endpoint;

    @Option(names = {"--gossip-bind"}, description = "Address to listen on for gossip (overrides config/env).")
    String gossipBind;

    @Option(names = {"--gossip-port"}, description = "UDP port to listen on for gossip (overrides config/env).")
    String gossipPort;

    @Option(names = {"--discovery-timeout"}, defaultValue = "15",
            description = "Seconds to wait for a web service announcement (default: ${DEFAULT-VALUE}).")
    long discoveryTimeoutSeconds;

    private ConfigStore store;
    private ResolvedContext resolved;
    private ConsoleSession session;

    public ConfigStore configStore() {
        if (store == null) {
            store = (configPath == null) ? new ConfigStore() : new ConfigStore(configPath);
        }
        return store;
    }

    public ResolvedContext resolvedContext() {
        if (resolved == null) {
            ResolvedContext base = configStore().loadResolvedContext();
            String bind = isBlank(gossipBind) ? base.gossipBind() : GossipDefaults.bindAddress(gossipBind);
            int port = isBlank(gossipPort) ? base.gossipPort() : GossipDefaults.port(gossipPort);
            String ep = isBlank(endpoint) ? base.endpoint() : endpoint;
            resolved = new ResolvedContext(base.contextName(), bind, port, ep, base.requestTimeout());
        }
        return resolved;
    }

    /**
     * Session connected to a backend: either the configured endpoint or the first one announced over gossip.
     */
    public ConsoleSession session() {
        if (session == null) {
            ResolvedContext ctx = resolvedContext();
            ConsoleSession created = ConsoleSession.create(ctx, new LoggingListener());
            session = created;
            if (ctx.usesDiscovery()) {
                if (!created.startDiscovery(ctx.gossipBind(), ctx.gossipPort())) {
                    throw new ConsoleException(FailureKind.DISCOVERY_BIND,
                            "Failed to bind gossip socket on " + ctx.gossipBind() + ":" + ctx.gossipPort());
                }
            } else {
                created.useEndpoint(ctx.endpoint());
            }
            awaitBackend(created);
        }
        return session;
    }

    /**
     * Blocks on a console future, surfacing its {@link ConsoleException}.
     */
    public <T> T await(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            throw ConsoleException.unwrap(e);
        }
    }

    @Override
    public void close() {
        if (session != null) {
            session.close();
            session = null;
        }
    }

    private void awaitBackend(ConsoleSession s) {
        try {
            String url = s.awaitBackend().get(discoveryTimeoutSeconds, TimeUnit.SECONDS);
            log.debug("Using web service at {}", url);
        } catch (TimeoutException e) {
            throw new ConsoleException(FailureKind.NO_BACKEND,
                    "No backend discovered within " + discoveryTimeoutSeconds + "s", e);
        } catch (ExecutionException e) {
            throw ConsoleException.unwrap(e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConsoleException(FailureKind.NO_BACKEND, "Interrupted while waiting for discovery", e);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static final class LoggingListener implements ConsoleListener {
        @Override
        public void operationFailed(ConsoleException failure) {
            log.debug("Console operation failed ({}): {}", failure.kind(), failure.getMessage());
        }

        @Override
        public void backendUrlChanged(String url) {
            log.info("Web service base URL: {}", url);
        }
    }
}
