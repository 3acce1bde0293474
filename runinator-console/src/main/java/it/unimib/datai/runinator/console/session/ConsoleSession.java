package it.unimib.datai.runinator.console.session;

import it.unimib.datai.runinator.common.model.ScheduledTask;
import it.unimib.datai.runinator.console.ConsoleException;
import it.unimib.datai.runinator.console.config.ResolvedContext;
import it.unimib.datai.runinator.console.discovery.DiscoveryRegistry;
import it.unimib.datai.runinator.console.discovery.GossipListener;
import it.unimib.datai.runinator.console.http.TaskOutcome;
import it.unimib.datai.runinator.console.http.TaskServiceClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Wires discovery to the task client and turns request outcomes into {@link ConsoleListener} events.
 *
 * <p>Every URL published by the registry is pushed into the client with {@link TaskServiceClient#setBaseUrl};
 * requests pick up the latest URL when they are issued. Listener callbacks run on the event loop.
 * A refresh attempted before any backend is known is repeated once the first URL arrives.</p>
 */
public final class ConsoleSession implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ConsoleSession.class);

    private final EventLoop loop;
    private final DiscoveryRegistry registry;
    private final TaskServiceClient client;
    private final ConsoleListener listener;
    private final AtomicBoolean pendingRefresh = new AtomicBoolean(false);
    private GossipListener gossip;
    private ScheduledFuture<?> autoRefresh;

    public static ConsoleSession create(ResolvedContext context, ConsoleListener listener) {
        EventLoop loop = new EventLoop();
        return new ConsoleSession(loop, new DiscoveryRegistry(),
                new TaskServiceClient(loop, context.requestTimeout()), listener);
    }

    ConsoleSession(EventLoop loop, DiscoveryRegistry registry, TaskServiceClient client, ConsoleListener listener) {
        this.loop = loop;
        this.registry = registry;
        this.client = client;
        this.listener = listener;
        registry.addUrlListener(this::onBackendUrl);
    }

    /**
     * Starts listening for gossip announcements.
     *
     * @return {@code false} when the socket could not be bound; the failure is also reported to the listener
     */
    public synchronized boolean startDiscovery(String bindAddress, int port) {
        if (gossip != null) {
            throw new IllegalStateException("Discovery already started");
        }
        gossip = new GossipListener(registry, loop, listener::operationFailed);
        return gossip.start(bindAddress, port);
    }

    /**
     * Uses a fixed backend instead of discovery.
     */
    public void useEndpoint(String baseUrl) {
        client.setBaseUrl(baseUrl);
        loop.execute(() -> onBackendUrl(baseUrl));
    }

    public CompletableFuture<String> awaitBackend() {
        String fixed = client.baseUrl();
        return fixed != null ? CompletableFuture.completedFuture(fixed) : registry.awaitServiceUrl();
    }

    public CompletableFuture<List<ScheduledTask>> refreshTasks() {
        if (!client.hasBaseUrl()) {
            pendingRefresh.set(true);
        }
        return client.listTasks().whenCompleteAsync((tasks, error) -> {
            if (error != null) {
                listener.operationFailed(ConsoleException.unwrap(error));
            } else {
                listener.tasksReplaced(tasks);
            }
        }, loop);
    }

    public CompletableFuture<TaskOutcome> requestRun(long taskId) {
        return client.requestRun(taskId).whenCompleteAsync((outcome, error) -> {
            if (error != null) {
                listener.operationFailed(ConsoleException.unwrap(error));
                return;
            }
            listener.runResult(outcome.success(), outcome.message());
            refreshTasks();
        }, loop);
    }

    public CompletableFuture<TaskOutcome> saveTask(ScheduledTask task) {
        return client.saveTask(task).whenCompleteAsync((outcome, error) -> {
            if (error != null) {
                listener.operationFailed(ConsoleException.unwrap(error));
                return;
            }
            listener.saveResult(outcome.success(), outcome.message(), outcome.creation());
            if (outcome.success()) {
                refreshTasks();
            }
        }, loop);
    }

    public CompletableFuture<TaskOutcome> deleteTask(long taskId) {
        return client.deleteTask(taskId).whenCompleteAsync((outcome, error) -> {
            if (error != null) {
                listener.operationFailed(ConsoleException.unwrap(error));
                return;
            }
            listener.deleteResult(outcome.success(), outcome.message());
            if (outcome.success()) {
                refreshTasks();
            }
        }, loop);
    }

    /**
     * Refreshes the task list every {@code interval} until the session is closed. Replaces any previous schedule.
     */
    public synchronized void startAutoRefresh(Duration interval) {
        if (autoRefresh != null) {
            autoRefresh.cancel(false);
        }
        autoRefresh = loop.scheduleAtFixedRate(() -> {
            if (client.hasBaseUrl()) {
                refreshTasks();
            }
        }, interval);
    }

    public DiscoveryRegistry registry() {
        return registry;
    }

    public TaskServiceClient client() {
        return client;
    }

    @Override
    public synchronized void close() {
        if (autoRefresh != null) {
            autoRefresh.cancel(false);
        }
        if (gossip != null) {
            gossip.close();
        }
        loop.close();
    }

    private void onBackendUrl(String url) {
        log.debug("Backend URL set to {}", url);
        client.setBaseUrl(url);
        listener.backendUrlChanged(url);
        if (pendingRefresh.compareAndSet(true, false)) {
            refreshTasks();
        }
    }
}
