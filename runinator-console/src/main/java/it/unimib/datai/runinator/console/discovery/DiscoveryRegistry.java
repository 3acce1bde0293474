package it.unimib.datai.runinator.console.discovery;

import it.unimib.datai.runinator.common.model.WebServiceAnnouncement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Known web service instances keyed by service id, and the base URL of the freshest one.
 *
 * <p>Mutators are meant to run on the owning event loop thread. {@link #currentUrl()} and
 * {@link #awaitServiceUrl()} may be called from any thread.</p>
 */
public final class DiscoveryRegistry {
    private static final Logger log = LoggerFactory.getLogger(DiscoveryRegistry.class);

    // Latest heartbeat wins; equal heartbeats go to the lexically smallest service id.
    private static final Comparator<WebServiceAnnouncement> FRESHEST = Comparator
            .comparing(WebServiceAnnouncement::lastHeartbeat)
            .thenComparing(WebServiceAnnouncement::serviceId, Comparator.reverseOrder());

    private final Map<String, WebServiceAnnouncement> services = new HashMap<>();
    private final List<Consumer<String>> urlListeners = new CopyOnWriteArrayList<>();
    private final CompletableFuture<String> firstUrl = new CompletableFuture<>();
    private volatile String currentUrl;

    public void addUrlListener(Consumer<String> listener) {
        urlListeners.add(listener);
    }

    /**
     * Stores the announcement, replacing any previous one with the same service id.
     * Does not recompute the active URL.
     *
     * @return whether the service id was unknown before
     */
    public boolean register(WebServiceAnnouncement announcement) {
        WebServiceAnnouncement previous = services.put(announcement.serviceId(), announcement);
        if (previous == null) {
            log.info("Discovered Runinator web service {} at {}:{}",
                    announcement.serviceId(), announcement.address(), announcement.port());
        }
        return previous == null;
    }

    /**
     * Stores a batch of announcements received in one pass, then recomputes the active URL once.
     */
    public void registerAll(Collection<WebServiceAnnouncement> announcements) {
        for (WebServiceAnnouncement announcement : announcements) {
            register(announcement);
        }
        refreshActiveUrl();
    }

    /**
     * Selects the freshest service and publishes its URL when it differs from the last published one.
     * An empty registry publishes nothing.
     */
    public void refreshActiveUrl() {
        Optional<WebServiceAnnouncement> best = services.values().stream().max(FRESHEST);
        if (best.isEmpty()) {
            return;
        }
        String url = best.get().baseUrl();
        if (url.equals(currentUrl)) {
            return;
        }
        log.info("Active Runinator web service is now {} ({})", url, best.get().serviceId());
        for (Consumer<String> listener : urlListeners) {
            try {
                listener.accept(url);
            } catch (RuntimeException e) {
                log.error("Service URL listener failed for {}", url, e);
            }
        }
        // Readers and waiters see the URL only after listeners have.
        currentUrl = url;
        firstUrl.complete(url);
    }

    public Optional<String> currentUrl() {
        return Optional.ofNullable(currentUrl);
    }

    /**
     * Completes with the current URL, or with the first one published from now on.
     */
    public CompletableFuture<String> awaitServiceUrl() {
        String url = currentUrl;
        return url != null ? CompletableFuture.completedFuture(url) : firstUrl.copy();
    }

    /**
     * Evicts services whose last heartbeat is older than {@code maxAge}, then recomputes.
     * Never invoked by the registry itself. When every entry is evicted the last published URL is kept.
     *
     * @return number of evicted services
     */
    public int pruneStale(Duration maxAge, Instant now) {
        Instant cutoff = now.minus(maxAge);
        int before = services.size();
        services.values().removeIf(svc -> svc.lastHeartbeat().isBefore(cutoff));
        int removed = before - services.size();
        if (removed > 0) {
            log.info("Removed {} stale service announcement(s)", removed);
            refreshActiveUrl();
        }
        return removed;
    }

    public Map<String, WebServiceAnnouncement> entries() {
        return Map.copyOf(services);
    }
}
