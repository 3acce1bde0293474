package it.unimib.datai.runinator.console.http;

import it.unimib.datai.runinator.common.codec.TaskCodec;
import it.unimib.datai.runinator.common.model.ScheduledTask;
import it.unimib.datai.runinator.console.ConsoleException;
import it.unimib.datai.runinator.console.FailureKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.Function;
import java.util.function.UnaryOperator;

/**
 * Asynchronous client for the Runinator web service task API.
 *
 * <p>The base URL may change at any time; each request reads it once when issued, so an in-flight
 * request completes against the URL it started with. Completions run on the callback executor.
 * Futures fail with {@link ConsoleException}.</p>
 */
public final class TaskServiceClient {
    private static final Logger log = LoggerFactory.getLogger(TaskServiceClient.class);

    public static final String NO_BACKEND_MESSAGE = "No backend discovered";
    public static final String UNEXPECTED_RESPONSE_MESSAGE = "Unexpected response from service";
    public static final String MISSING_ID_MESSAGE = "Task is missing an id";
    static final String UNPARSABLE_LIST_MESSAGE = "Failed to parse task list";

    static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);

    private final HttpClient http;
    private final HttpJson json;
    private final Executor callbackExecutor;
    private final Duration requestTimeout;
    private volatile String baseUrl;

    public TaskServiceClient(Executor callbackExecutor, Duration requestTimeout) {
        this(HttpClient.newBuilder().connectTimeout(CONNECT_TIMEOUT).build(), new HttpJson(),
                callbackExecutor, requestTimeout);
    }

    TaskServiceClient(HttpClient http, HttpJson json, Executor callbackExecutor, Duration requestTimeout) {
        this.http = http;
        this.json = json;
        this.callbackExecutor = callbackExecutor;
        this.requestTimeout = requestTimeout;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = (baseUrl == null || baseUrl.isBlank()) ? null : baseUrl;
    }

    public String baseUrl() {
        return baseUrl;
    }

    public boolean hasBaseUrl() {
        return baseUrl != null;
    }

    public CompletableFuture<List<ScheduledTask>> listTasks() {
        return exchange("list tasks", "tasks", HttpRequest.Builder::GET, this::decodeTaskList);
    }

    public CompletableFuture<TaskOutcome> requestRun(long taskId) {
        return exchange("request run", "tasks/" + taskId + "/request_run",
                b -> b.header("Content-Type", "application/json")
                        .POST(HttpRequest.BodyPublishers.noBody()),
                body -> TaskOutcome.of(decodeOutcome(body), false));
    }

    public CompletableFuture<TaskOutcome> createTask(ScheduledTask task) {
        String payload = json.toJson(TaskCodec.encode(task));
        return exchange("create task", "tasks",
                b -> b.header("Content-Type", "application/json")
                        .POST(HttpRequest.BodyPublishers.ofString(payload)),
                body -> TaskOutcome.of(decodeOutcome(body), true));
    }

    public CompletableFuture<TaskOutcome> updateTask(ScheduledTask task) {
        if (!hasBaseUrl()) {
            return noBackend();
        }
        if (task.id() == null) {
            return CompletableFuture.failedFuture(new ConsoleException(FailureKind.PRECONDITION, MISSING_ID_MESSAGE));
        }
        String payload = json.toJson(TaskCodec.encode(task));
        return exchange("update task", "tasks/" + task.id(),
                b -> b.header("Content-Type", "application/json")
                        .method("PATCH", HttpRequest.BodyPublishers.ofString(payload)),
                body -> TaskOutcome.of(decodeOutcome(body), false));
    }

    /**
     * Creates the task when it has no id yet, updates it otherwise.
     */
    public CompletableFuture<TaskOutcome> saveTask(ScheduledTask task) {
        return task.isPendingCreation() ? createTask(task) : updateTask(task);
    }

    public CompletableFuture<TaskOutcome> deleteTask(long taskId) {
        return exchange("delete task", "tasks/" + taskId, HttpRequest.Builder::DELETE,
                body -> TaskOutcome.of(decodeOutcome(body), false));
    }

    /**
     * Joins a base URL and a relative path with exactly one slash between them.
     */
    public static String buildUrl(String base, String path) {
        String trimmed = path == null ? "" : path;
        while (trimmed.startsWith("/")) {
            trimmed = trimmed.substring(1);
        }
        String prefix = base.endsWith("/") ? base : base + "/";
        return prefix + trimmed;
    }

    private <T> CompletableFuture<T> exchange(String action,
                                              String path,
                                              UnaryOperator<HttpRequest.Builder> method,
                                              Function<String, T> decoder) {
        String base = baseUrl;
        if (base == null) {
            return noBackend();
        }

        HttpRequest request;
        try {
            request = method.apply(HttpRequest.newBuilder(URI.create(buildUrl(base, path)))
                    .timeout(requestTimeout)).build();
        } catch (IllegalArgumentException e) {
            return CompletableFuture.failedFuture(
                    new ConsoleException(FailureKind.TRANSPORT, "Invalid backend URL: " + base, e));
        }

        log.debug("{} {} ({})", request.method(), request.uri(), action);
        CompletableFuture<T> result = new CompletableFuture<>();
        http.sendAsync(request, HttpResponse.BodyHandlers.ofString())
                .whenCompleteAsync((resp, error) -> {
                    try {
                        result.complete(decoder.apply(successBody(action, resp, error)));
                    } catch (ConsoleException e) {
                        log.warn("Backend call '{}' failed ({}): {}", action, e.kind(), e.getMessage());
                        result.completeExceptionally(e);
                    } catch (RuntimeException e) {
                        log.warn("Backend call '{}' failed while decoding", action, e);
                        result.completeExceptionally(
                                new ConsoleException(FailureKind.UNEXPECTED_RESPONSE, UNEXPECTED_RESPONSE_MESSAGE, e));
                    }
                }, callbackExecutor);
        return result;
    }

    private static String successBody(String action, HttpResponse<String> resp, Throwable error) {
        if (error != null) {
            Throwable cause = (error instanceof CompletionException && error.getCause() != null)
                    ? error.getCause()
                    : error;
            String description = cause.getMessage() == null || cause.getMessage().isBlank()
                    ? cause.getClass().getSimpleName()
                    : cause.getMessage();
            throw new ConsoleException(FailureKind.TRANSPORT,
                    "I/O error calling backend during " + action + ": " + description, cause);
        }
        int status = resp.statusCode();
        if (status < 200 || status > 299) {
            String body = resp.body();
            String message = ServiceError.extractMessage(body, "Backend HTTP " + status + " during " + action);
            throw new ConsoleException(FailureKind.TRANSPORT, status, message, body, null);
        }
        return resp.body();
    }

    private List<ScheduledTask> decodeTaskList(String body) {
        ResponseEnvelope envelope;
        try {
            envelope = ResponseEnvelope.classify(json.readTree(body));
        } catch (IllegalArgumentException e) {
            throw new ConsoleException(FailureKind.UNEXPECTED_RESPONSE, UNPARSABLE_LIST_MESSAGE, e);
        }
        if (envelope instanceof ResponseEnvelope.TaskList list) {
            return list.tasks();
        }
        if (envelope instanceof ResponseEnvelope.MessageOnly msg) {
            throw new ConsoleException(FailureKind.UNEXPECTED_RESPONSE, msg.message());
        }
        if (envelope instanceof ResponseEnvelope.Outcome outcome && !outcome.message().isEmpty()) {
            throw new ConsoleException(FailureKind.UNEXPECTED_RESPONSE, outcome.message());
        }
        throw new ConsoleException(FailureKind.UNEXPECTED_RESPONSE, UNEXPECTED_RESPONSE_MESSAGE);
    }

    private ResponseEnvelope.Outcome decodeOutcome(String body) {
        ResponseEnvelope envelope;
        try {
            envelope = ResponseEnvelope.classify(json.readTree(body));
        } catch (IllegalArgumentException e) {
            throw new ConsoleException(FailureKind.UNEXPECTED_RESPONSE, UNEXPECTED_RESPONSE_MESSAGE, e);
        }
        if (envelope instanceof ResponseEnvelope.Outcome outcome) {
            return outcome;
        }
        throw new ConsoleException(FailureKind.UNEXPECTED_RESPONSE, UNEXPECTED_RESPONSE_MESSAGE);
    }

    private static <T> CompletableFuture<T> noBackend() {
        return CompletableFuture.failedFuture(new ConsoleException(FailureKind.NO_BACKEND, NO_BACKEND_MESSAGE));
    }
}
