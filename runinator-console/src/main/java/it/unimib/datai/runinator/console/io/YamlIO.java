package it.unimib.datai.runinator.console.io;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;

/**
 * Reads task files. JSON documents are accepted as well, being valid YAML.
 */
public final class YamlIO {
    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());

    private YamlIO() {}

    public static JsonNode readTree(Path path) {
        try {
            JsonNode node = YAML.readTree(path.toFile());
            if (node == null || !node.isObject()) {
                throw new IllegalArgumentException("Expected a mapping at the top of " + path);
            }
            return node;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read YAML: " + path, e);
        }
    }
}
