package it.unimib.datai.runinator.console.discovery;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import it.unimib.datai.runinator.common.codec.TaskTimestamps;
import it.unimib.datai.runinator.common.model.WebServiceAnnouncement;

import java.io.IOException;
import java.time.Instant;
import java.util.Optional;

/**
 * Tolerant decoder for gossip datagrams. Anything that is not a usable web service announcement
 * decodes to {@link Optional#empty()}.
 */
public final class AnnouncementDecoder {
    public static final String WEB_SERVICE_TYPE = "web_service";

    private final ObjectMapper mapper;

    public AnnouncementDecoder() {
        this(new ObjectMapper());
    }

    AnnouncementDecoder(ObjectMapper mapper) {
        this.mapper = mapper.copy().enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    /**
     * @param senderAddress address the datagram came from, used when the announcement omits its own
     * @param now           heartbeat used when the announcement carries none, or an unparsable one
     */
    public Optional<WebServiceAnnouncement> decode(byte[] payload, String senderAddress, Instant now) {
        JsonNode root;
        try {
            root = mapper.readTree(payload);
        } catch (IOException e) {
            return Optional.empty();
        }
        if (root == null || !root.isObject()) {
            return Optional.empty();
        }
        if (!WEB_SERVICE_TYPE.equals(root.path("type").asText(null))) {
            return Optional.empty();
        }
        JsonNode service = root.get("service");
        if (service == null || !service.isObject()) {
            return Optional.empty();
        }

        JsonNode portNode = service.get("port");
        if (portNode == null || !portNode.canConvertToInt()) {
            return Optional.empty();
        }
        int port = portNode.asInt();
        if (port <= 0 || port > 65535) {
            return Optional.empty();
        }

        String address = text(service, "address");
        if (address == null || address.isBlank()) {
            address = senderAddress;
        }
        if (address == null || address.isBlank()) {
            return Optional.empty();
        }
        address = address.trim();

        String serviceId = text(service, "service_id");
        if (serviceId == null || serviceId.isBlank()) {
            serviceId = address + ":" + port;
        }

        String basePath = text(service, "base_path");
        if (basePath != null) {
            basePath = basePath.trim();
            if (basePath.isEmpty()) {
                basePath = null;
            }
        }

        Instant heartbeat = TaskTimestamps.parse(text(service, "last_heartbeat"));
        if (heartbeat == null) {
            heartbeat = now;
        }

        return Optional.of(new WebServiceAnnouncement(serviceId, address, port, basePath, heartbeat));
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isTextual() ? value.asText() : null;
    }
}
