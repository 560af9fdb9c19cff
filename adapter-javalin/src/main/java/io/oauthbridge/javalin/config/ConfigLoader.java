package io.oauthbridge.javalin.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.oauthbridge.core.error.WebException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Map;

/**
 * Loads {@link BridgeConfig} from YAML.
 *
 * <p>
 * Recognized keys:
 * <pre>{@code
 * dispatch:
 *   mailbox-capacity: 64
 *   timeout-ms: 30000
 *   worker-name: oauth-endpoint
 * errors:
 *   status:
 *     authorization: 400
 * }</pre>
 * Missing keys receive the defaults of {@link BridgeConfig.Builder}. Keys
 * under {@code errors.status} must name a {@link WebException.Kind} by its
 * id and map it to a status within 400..599.
 */
public final class ConfigLoader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ConfigLoader() {
        // utility class
    }

    /**
     * Loads configuration from a YAML file.
     *
     * @throws ConfigLoadException if the file is missing, is not valid YAML or
     *                             holds an invalid value
     */
    public static BridgeConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException("Configuration file not found: " + configPath);
        }
        try (InputStream in = Files.newInputStream(configPath)) {
            return parse(in, configPath.toString());
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to read configuration: " + configPath, e);
        }
    }

    /**
     * Loads configuration from a classpath resource.
     *
     * @throws ConfigLoadException if the resource is missing or invalid
     */
    public static BridgeConfig loadResource(String resource) {
        InputStream in = ConfigLoader.class.getClassLoader().getResourceAsStream(resource);
        if (in == null) {
            throw new ConfigLoadException("Configuration resource not found: " + resource);
        }
        try (in) {
            return parse(in, "classpath:" + resource);
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to read configuration: classpath:" + resource, e);
        }
    }

    private static BridgeConfig parse(InputStream in, String source) {
        JsonNode root;
        try {
            root = YAML_MAPPER.readTree(in);
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + source, e);
        }
        try {
            return mapToConfig(root != null ? root : YAML_MAPPER.createObjectNode());
        } catch (IllegalArgumentException e) {
            throw new ConfigLoadException("Invalid configuration in " + source + ": " + e.getMessage(), e);
        }
    }

    private static BridgeConfig mapToConfig(JsonNode root) {
        BridgeConfig.Builder builder = BridgeConfig.builder();

        JsonNode dispatch = root.path("dispatch");
        if (dispatch.has("mailbox-capacity"))
            builder.mailboxCapacity(intValue(dispatch, "dispatch.mailbox-capacity", "mailbox-capacity"));
        if (dispatch.has("timeout-ms")) {
            JsonNode timeout = dispatch.get("timeout-ms");
            if (!timeout.isIntegralNumber()) {
                throw new IllegalArgumentException("dispatch.timeout-ms must be an integer, was '" + timeout.asText() + "'");
            }
            builder.timeoutMs(timeout.asLong());
        }
        if (dispatch.has("worker-name")) builder.workerName(dispatch.get("worker-name").asText());

        JsonNode status = root.path("errors").path("status");
        Iterator<Map.Entry<String, JsonNode>> fields = status.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            WebException.Kind kind = WebException.Kind.fromId(field.getKey());
            builder.errorStatus(kind, intValue(status, "errors.status." + field.getKey(), field.getKey()));
        }

        return builder.build();
    }

    private static int intValue(JsonNode parent, String key, String field) {
        JsonNode node = parent.get(field);
        if (!node.isInt()) {
            throw new IllegalArgumentException(key + " must be an integer, was '" + node.asText() + "'");
        }
        return node.intValue();
    }
}
