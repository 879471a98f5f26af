package com.kiln.rpc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.kiln.component.Artifact;
import com.kiln.component.ConfigBundle;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Jackson mapping between wire JSON and the component value types.
 * Decoding failures surface as {@link IllegalArgumentException}; callers map them to a protocol error.
 */
public final class RpcCodec {

    static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private RpcCodec() {
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    public static ObjectNode object() {
        return MAPPER.createObjectNode();
    }

    static String write(RpcMessage message) throws JsonProcessingException {
        return MAPPER.writeValueAsString(message);
    }

    static RpcMessage read(String line) throws JsonProcessingException {
        return MAPPER.readValue(line, RpcMessage.class);
    }

    public static JsonNode bundle(ConfigBundle bundle) {
        return bundle == null ? NullNode.getInstance() : MAPPER.valueToTree(bundle.toPlainMap());
    }

    public static ConfigBundle bundle(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return ConfigBundle.empty();
        }
        if (!node.isObject()) {
            throw new IllegalArgumentException("expected configuration object, got " + node.getNodeType());
        }
        return ConfigBundle.of(MAPPER.convertValue(node, MAP_TYPE));
    }

    public static ArrayNode bundles(List<ConfigBundle> bundles) {
        ArrayNode array = MAPPER.createArrayNode();
        for (ConfigBundle b : bundles) {
            array.add(bundle(b));
        }
        return array;
    }

    public static List<ConfigBundle> bundles(JsonNode node) {
        List<ConfigBundle> out = new ArrayList<>();
        if (node == null || node.isNull()) {
            return out;
        }
        if (!node.isArray()) {
            throw new IllegalArgumentException("expected array of configuration objects");
        }
        for (JsonNode element : node) {
            out.add(bundle(element));
        }
        return out;
    }

    public static JsonNode artifact(Artifact artifact) {
        return artifact == null ? NullNode.getInstance() : MAPPER.valueToTree(artifact);
    }

    public static Artifact artifact(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        try {
            return MAPPER.treeToValue(node, Artifact.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("malformed artifact: " + e.getOriginalMessage(), e);
        }
    }

    public static ArrayNode strings(List<String> values) {
        ArrayNode array = MAPPER.createArrayNode();
        if (values != null) {
            values.forEach(array::add);
        }
        return array;
    }

    public static List<String> strings(JsonNode node) {
        List<String> out = new ArrayList<>();
        if (node == null || node.isNull()) {
            return out;
        }
        if (!node.isArray()) {
            throw new IllegalArgumentException("expected array of strings");
        }
        for (JsonNode element : node) {
            if (!element.isTextual()) {
                throw new IllegalArgumentException("expected string, got " + element.getNodeType());
            }
            out.add(element.asText());
        }
        return out;
    }

    /** Text field or null when absent or JSON null. */
    public static String text(JsonNode args, String field) {
        JsonNode v = args == null ? null : args.get(field);
        if (v == null || v.isNull()) {
            return null;
        }
        if (!v.isTextual()) {
            throw new IllegalArgumentException(field + ": expected string, got " + v.getNodeType());
        }
        return v.asText();
    }

    public static String requireText(JsonNode args, String field) {
        String v = text(args, field);
        if (v == null) {
            throw new IllegalArgumentException("missing argument '" + field + "'");
        }
        return v;
    }
}
