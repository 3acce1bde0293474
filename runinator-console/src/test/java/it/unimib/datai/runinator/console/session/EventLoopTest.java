package it.unimib.datai.runinator.console.session;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class EventLoopTest {

    @Test
    void tasksRunOnLoopThread() {
        try (EventLoop loop = new EventLoop()) {
            CompletableFuture<String> threadName = new CompletableFuture<>();
            loop.execute(() -> threadName.complete(Thread.currentThread().getName()));

            assertThat(threadName.join()).isEqualTo(EventLoop.THREAD_NAME);
            assertThat(Thread.currentThread().getName()).isNotEqualTo(EventLoop.THREAD_NAME);
        }
    }

    @Test
    void failingTaskDoesNotStopLoop() {
        try (EventLoop loop = new EventLoop()) {
            loop.execute(() -> {
                throw new IllegalStateException("boom");
            });
            CompletableFuture<String> next = new CompletableFuture<>();
            loop.execute(() -> next.complete("still running"));

            assertThat(next.join()).isEqualTo("still running");
        }
    }

    @Test
    void periodicTaskSurvivesFailures() {
        try (EventLoop loop = new EventLoop()) {
            AtomicInteger runs = new AtomicInteger();
            ScheduledFuture<?> periodic = loop.scheduleAtFixedRate(() -> {
                if (runs.incrementAndGet() == 1) {
                    throw new IllegalStateException("first run fails");
                }
            }, Duration.ofMillis(20));

            await().atMost(Duration.ofSeconds(5)).until(() -> runs.get() >= 3);
            periodic.cancel(false);
        }
    }
}
