package it.unimib.datai.runinator.console.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.function.Function;

public final class ConfigStore {
    static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);

    private final Path path;
    private final ObjectMapper yaml;
    private final Function<String, String> getenv;

    public ConfigStore() {
        this(defaultPath(), System::getenv);
    }

    public ConfigStore(Path path) {
        this(path, System::getenv);
    }

    public ConfigStore(Path path, Function<String, String> getenv) {
        this.path = path;
        this.getenv = getenv;
        this.yaml = new ObjectMapper(new YAMLFactory())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public Config load() {
        if (!Files.exists(path)) {
            return new Config();
        }
        try {
            return yaml.readValue(path.toFile(), Config.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read config: " + path, e);
        }
    }

    public ResolvedContext loadResolvedContext() {
        Config cfg = load();

        String contextName = firstNonBlank(getenv.apply("RUNINATOR_CONTEXT"), cfg.getCurrentContext());
        Context ctx = (contextName == null || cfg.getContexts() == null) ? null : cfg.getContexts().get(contextName);

        String bind = firstNonBlank(getenv.apply("RUNINATOR_GOSSIP_BIND"), ctx == null ? null : ctx.getGossipBind());
        String port = firstNonBlank(getenv.apply("RUNINATOR_GOSSIP_PORT"), ctx == null ? null : ctx.getGossipPort());
        String endpoint = firstNonBlank(getenv.apply("RUNINATOR_ENDPOINT"), ctx == null ? null : ctx.getEndpoint());

        Duration timeout = DEFAULT_REQUEST_TIMEOUT;
        if (ctx != null && ctx.getRequestTimeoutSeconds() != null && ctx.getRequestTimeoutSeconds() > 0) {
            timeout = Duration.ofSeconds(ctx.getRequestTimeoutSeconds());
        }

        return new ResolvedContext(
                contextName,
                GossipDefaults.bindAddress(bind),
                GossipDefaults.port(port),
                endpoint,
                timeout);
    }

    private static Path defaultPath() {
        String home = System.getProperty("user.home");
        return Path.of(home, ".config", "runinator", "console.yaml");
    }

    static String firstNonBlank(String... values) {
        if (values == null) {
            return null;
        }
        for (String v : values) {
            if (v != null && !v.isBlank()) {
                return v;
            }
        }
        return null;
    }
}
