package it.unimib.datai.runinator.console.config;

import java.time.Duration;

/**
 * Effective console settings after layering options, environment, config file and defaults.
 *
 * @param endpoint fixed backend base URL, or {@code null} to use gossip discovery
 */
public record ResolvedContext(
        String contextName,
        String gossipBind,
        int gossipPort,
        String endpoint,
        Duration requestTimeout
) {
    public boolean usesDiscovery() {
        return endpoint == null || endpoint.isBlank();
    }
}
