package it.unimib.datai.runinator.common.model;

import java.time.Instant;

/**
 * Self-reported reachability of one web service instance, as carried by a gossip datagram.
 *
 * <p>{@code basePath} is {@code null} when the service is mounted at the root.</p>
 */
public record WebServiceAnnouncement(
        String serviceId,
        String address,
        int port,
        String basePath,
        Instant lastHeartbeat
) {
    public String baseUrl() {
        StringBuilder url = new StringBuilder("http://").append(address).append(':').append(port);
        if (basePath != null && !basePath.isBlank()) {
            String trimmed = basePath.trim();
            if (!trimmed.startsWith("/")) {
                url.append('/');
            }
            url.append(trimmed);
        }
        if (url.charAt(url.length() - 1) != '/') {
            url.append('/');
        }
        return url.toString();
    }
}
