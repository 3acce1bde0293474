package it.unimib.datai.runinator.console.config;

public final class GossipDefaults {
    public static final String BIND_ADDRESS = "127.0.0.1";
    public static final int PORT = 5504;
    public static final int INVALID_PORT_FALLBACK = 5000;

    private GossipDefaults() {}

    public static String bindAddress(String raw) {
        return (raw == null || raw.isBlank()) ? BIND_ADDRESS : raw.trim();
    }

    /**
     * Resolves the gossip port: {@link #PORT} when nothing (or only whitespace) was supplied,
     * {@link #INVALID_PORT_FALLBACK} when the value is not a valid UDP port.
     */
    public static int port(String raw) {
        if (raw == null || raw.isBlank()) {
            return PORT;
        }
        try {
            int port = Integer.parseInt(raw.trim());
            return (port < 0 || port > 65535) ? INVALID_PORT_FALLBACK : port;
        } catch (NumberFormatException e) {
            return INVALID_PORT_FALLBACK;
        }
    }
}
