package it.unimib.datai.runinator.console.session;

import it.unimib.datai.runinator.common.model.ScheduledTask;
import it.unimib.datai.runinator.common.model.WebServiceAnnouncement;
import it.unimib.datai.runinator.console.ConsoleException;
import it.unimib.datai.runinator.console.FailureKind;
import it.unimib.datai.runinator.console.discovery.DiscoveryRegistry;
import it.unimib.datai.runinator.console.http.TaskServiceClient;
import it.unimib.datai.runinator.console.testsupport.GossipSender;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static it.unimib.datai.runinator.console.testsupport.GossipSender.announcement;
import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;

class ConsoleSessionTest {

    private MockWebServer server;
    private EventLoop loop;
    private DiscoveryRegistry registry;
    private ConsoleListener listener;
    private ConsoleSession session;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        loop = new EventLoop();
        registry = new DiscoveryRegistry();
        listener = mock(ConsoleListener.class);
        session = new ConsoleSession(loop, registry, new TaskServiceClient(loop, Duration.ofSeconds(5)), listener);
    }

    @AfterEach
    void tearDown() throws Exception {
        session.close();
        server.shutdown();
    }

    @Test
    void refreshWithoutBackendReportsNoBackend() {
        session.refreshTasks();

        ArgumentCaptor<ConsoleException> failure = ArgumentCaptor.forClass(ConsoleException.class);
        verify(listener, timeout(2000)).operationFailed(failure.capture());
        assertThat(failure.getValue().kind()).isEqualTo(FailureKind.NO_BACKEND);
        assertThat(failure.getValue().getMessage()).isEqualTo("No backend discovered");
        verify(listener, never()).tasksReplaced(anyList());
        assertThat(server.getRequestCount()).isZero();
    }

    @Test
    void refreshDeliversTasksOnEventLoop() {
        server.enqueue(json("[{\"id\":1,\"name\":\"backup\",\"cron_schedule\":\"0 3 * * *\"}]"));
        String[] deliveredOn = new String[1];
        doAnswer(inv -> {
            deliveredOn[0] = Thread.currentThread().getName();
            return null;
        }).when(listener).tasksReplaced(anyList());
        session.useEndpoint(server.url("/").toString());

        List<ScheduledTask> tasks = session.refreshTasks().join();

        assertThat(tasks).extracting(ScheduledTask::name).containsExactly("backup");
        verify(listener).tasksReplaced(tasks);
        assertThat(deliveredOn[0]).isEqualTo(EventLoop.THREAD_NAME);
    }

    @Test
    void runResultIsFollowedByRefresh() throws Exception {
        server.enqueue(json("{\"success\":true,\"message\":\"queued\"}"));
        server.enqueue(json("[]"));
        session.useEndpoint(server.url("/").toString());

        session.requestRun(12).join();

        InOrder order = inOrder(listener);
        order.verify(listener, timeout(2000)).runResult(true, "queued");
        order.verify(listener, timeout(2000)).tasksReplaced(List.of());
        assertThat(server.takeRequest().getPath()).isEqualTo("/tasks/12/request_run");
        RecordedRequest refresh = server.takeRequest(2, TimeUnit.SECONDS);
        assertThat(refresh.getMethod()).isEqualTo("GET");
        assertThat(refresh.getPath()).isEqualTo("/tasks");
    }

    @Test
    void rejectedRunStillRefreshes() {
        server.enqueue(json("{\"success\":false,\"message\":\"task is disabled\"}"));
        server.enqueue(json("[]"));
        session.useEndpoint(server.url("/").toString());

        session.requestRun(3);

        verify(listener, timeout(2000)).runResult(false, "task is disabled");
        verify(listener, timeout(2000)).tasksReplaced(List.of());
    }

    @Test
    void saveReportsCreationFlag() {
        server.enqueue(json("{\"success\":true,\"message\":\"created\"}"));
        server.enqueue(json("[]"));
        server.enqueue(json("{\"success\":true,\"message\":\"updated\"}"));
        server.enqueue(json("[]"));
        session.useEndpoint(server.url("/").toString());

        session.saveTask(task(null)).join();
        verify(listener, timeout(2000)).saveResult(true, "created", true);
        verify(listener, timeout(2000)).tasksReplaced(List.of());

        session.saveTask(task(4L)).join();
        verify(listener, timeout(2000)).saveResult(true, "updated", false);
    }

    @Test
    void refusedSaveDoesNotRefresh() throws Exception {
        server.enqueue(json("{\"success\":false,\"message\":\"Invalid cron expression\"}"));
        session.useEndpoint(server.url("/").toString());

        session.saveTask(task(null)).join();

        verify(listener, timeout(2000)).saveResult(false, "Invalid cron expression", true);
        Thread.sleep(200);
        assertThat(server.getRequestCount()).isEqualTo(1);
        verify(listener, never()).tasksReplaced(anyList());
    }

    @Test
    void refreshBeforeDiscoveryIsRetriedWhenBackendAppears() {
        server.enqueue(json("[{\"id\":3,\"name\":\"late\"}]"));

        session.refreshTasks();
        verify(listener, timeout(2000)).operationFailed(any());
        session.useEndpoint(server.url("/").toString());

        ArgumentCaptor<List<ScheduledTask>> tasks = listCaptor();
        verify(listener, timeout(2000)).tasksReplaced(tasks.capture());
        assertThat(tasks.getValue()).extracting(ScheduledTask::name).containsExactly("late");
        assertThat(server.getRequestCount()).isEqualTo(1);
    }

    @Test
    void deleteFailureIsReportedAndSkipsRefresh() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(404).setBody("{\"message\":\"no such task\"}"));
        session.useEndpoint(server.url("/").toString());

        session.deleteTask(99);

        ArgumentCaptor<ConsoleException> failure = ArgumentCaptor.forClass(ConsoleException.class);
        verify(listener, timeout(2000)).operationFailed(failure.capture());
        assertThat(failure.getValue().status()).isEqualTo(404);
        assertThat(failure.getValue().getMessage()).isEqualTo("no such task");
        verify(listener, never()).deleteResult(anyBoolean(), any());
        assertThat(server.getRequestCount()).isEqualTo(1);
    }

    @Test
    void deleteSuccessRefreshes() {
        server.enqueue(json("{\"success\":true,\"message\":\"deleted\"}"));
        server.enqueue(json("[]"));
        session.useEndpoint(server.url("/").toString());

        session.deleteTask(7);

        verify(listener, timeout(2000)).deleteResult(true, "deleted");
        verify(listener, timeout(2000)).tasksReplaced(List.of());
    }

    @Test
    void publishedUrlRetargetsClient() {
        loop.execute(() -> registry.registerAll(List.of(new WebServiceAnnouncement(
                "ws-1", server.getHostName(), server.getPort(), null, Instant.now()))));

        String url = session.awaitBackend().join();

        assertThat(url).isEqualTo("http://" + server.getHostName() + ":" + server.getPort() + "/");
        verify(listener, timeout(2000)).backendUrlChanged(url);
        assertThat(session.client().baseUrl()).isEqualTo(url);
    }

    @Test
    void gossipDiscoveryLeadsToWorkingClient() throws Exception {
        int port = GossipSender.freeUdpPort();
        assertThat(session.startDiscovery("127.0.0.1", port)).isTrue();
        server.enqueue(json("[{\"id\":8,\"name\":\"report\"}]"));

        try (GossipSender sender = new GossipSender(port)) {
            sender.send(announcement("ws-1", server.getHostName(), server.getPort(), "2024-05-01T12:00:00.000Z"));
        }
        String url = session.awaitBackend().get(5, TimeUnit.SECONDS);
        List<ScheduledTask> tasks = session.refreshTasks().get(5, TimeUnit.SECONDS);

        assertThat(url).endsWith(":" + server.getPort() + "/");
        assertThat(tasks).extracting(ScheduledTask::id).containsExactly(8L);
    }

    @Test
    void discoveryBindFailureIsReported() {
        boolean started = session.startDiscovery("203.0.113.1", 5504);

        assertThat(started).isFalse();
        ArgumentCaptor<ConsoleException> failure = ArgumentCaptor.forClass(ConsoleException.class);
        verify(listener, timeout(2000)).operationFailed(failure.capture());
        assertThat(failure.getValue().kind()).isEqualTo(FailureKind.DISCOVERY_BIND);
    }

    @Test
    void autoRefreshPollsUntilClosed() {
        for (int i = 0; i < 20; i++) {
            server.enqueue(json("[]"));
        }
        session.useEndpoint(server.url("/").toString());

        session.startAutoRefresh(Duration.ofMillis(100));

        await().atMost(Duration.ofSeconds(5)).until(() -> server.getRequestCount() >= 3);
        verify(listener, timeout(2000).atLeast(3)).tasksReplaced(List.of());
    }

    @Test
    void autoRefreshIsIdleWithoutBackend() throws Exception {
        session.startAutoRefresh(Duration.ofMillis(50));

        Thread.sleep(300);

        verify(listener, never()).operationFailed(any());
        assertThat(server.getRequestCount()).isZero();
    }

    @SuppressWarnings("unchecked")
    private static ArgumentCaptor<List<ScheduledTask>> listCaptor() {
        return ArgumentCaptor.forClass(List.class);
    }

    private static MockResponse json(String body) {
        return new MockResponse()
                .setResponseCode(200)
                .addHeader("Content-Type", "application/json")
                .setBody(body);
    }

    private static ScheduledTask task(Long id) {
        return new ScheduledTask(id, "backup", "0 3 * * *", "console", "run_command", "{}",
                60000, null, true, false, null, null);
    }
}
