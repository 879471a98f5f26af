package com.kiln.environment.build;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kiln.component.ConfigBundle;
import com.kiln.component.error.ConfigException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A build description: builders, provisioners, post-processors and named hooks, read from JSON.
 * <pre>
 * { "builders": [ {"type": "null", "name": "a", ...config} ],
 *   "provisioners": [ {"type": "shell-local", ...config} ],
 *   "post-processors": [ "checksum" or {"type": "checksum", ...config} ],
 *   "hooks": { "&lt;hook-name&gt;": ["echo"] } }
 * </pre>
 * Values are taken literally; there is no variable interpolation.
 */
public final class BuildTemplate {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};
    private static final Set<String> SECTIONS = Set.of("builders", "provisioners", "post-processors", "hooks");

    /**
     * One configured component.
     *
     * @param type   component name to load
     * @param name   display name; defaults to {@code type}
     * @param config configuration without {@code type} and {@code name}
     */
    public record ComponentSpec(String type, String name, ConfigBundle config) {
        public ComponentSpec {
            Objects.requireNonNull(type, "type");
            name = name != null ? name : type;
            config = config != null ? config : ConfigBundle.empty();
        }
    }

    private final List<ComponentSpec> builders;
    private final List<ComponentSpec> provisioners;
    private final List<ComponentSpec> postProcessors;
    private final Map<String, List<String>> hooks;

    public BuildTemplate(List<ComponentSpec> builders, List<ComponentSpec> provisioners,
                         List<ComponentSpec> postProcessors, Map<String, List<String>> hooks) {
        this.builders = List.copyOf(builders);
        this.provisioners = List.copyOf(provisioners);
        this.postProcessors = List.copyOf(postProcessors);
        Map<String, List<String>> copy = new LinkedHashMap<>();
        hooks.forEach((k, v) -> copy.put(k, List.copyOf(v)));
        this.hooks = Collections.unmodifiableMap(copy);
    }

    public List<ComponentSpec> getBuilders() {
        return builders;
    }

    public List<ComponentSpec> getProvisioners() {
        return provisioners;
    }

    public List<ComponentSpec> getPostProcessors() {
        return postProcessors;
    }

    public Map<String, List<String>> getHooks() {
        return hooks;
    }

    /**
     * @throws ConfigException listing every structural problem, or when the file cannot be read
     */
    public static BuildTemplate read(Path file) {
        String json;
        try {
            json = Files.readString(file);
        } catch (IOException e) {
            throw new ConfigException("Failed to read build description " + file + ": " + e.getMessage());
        }
        return parse(json);
    }

    /**
     * @throws ConfigException listing every structural problem
     */
    public static BuildTemplate parse(String json) {
        JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ConfigException("Failed to parse build description: " + e.getOriginalMessage());
        }
        if (root == null || !root.isObject()) {
            throw new ConfigException("Build description must be a JSON object");
        }
        List<String> errors = new ArrayList<>();
        for (Iterator<String> it = root.fieldNames(); it.hasNext(); ) {
            String key = it.next();
            if (!SECTIONS.contains(key)) {
                errors.add("unknown section: '" + key + "'");
            }
        }
        List<ComponentSpec> builders = components(root.get("builders"), "builders", false, errors);
        JsonNode builderSection = root.get("builders");
        if (builderSection == null || builderSection.isNull() || (builderSection.isArray() && builderSection.isEmpty())) {
            errors.add("at least one builder must be defined");
        }
        Set<String> names = new LinkedHashSet<>();
        for (ComponentSpec b : builders) {
            if (!names.add(b.name())) {
                errors.add("builders: duplicate build name '" + b.name() + "'");
            }
        }
        List<ComponentSpec> provisioners = components(root.get("provisioners"), "provisioners", false, errors);
        List<ComponentSpec> postProcessors = components(root.get("post-processors"), "post-processors", true, errors);
        Map<String, List<String>> hooks = hooks(root.get("hooks"), errors);
        if (!errors.isEmpty()) {
            throw new ConfigException(errors);
        }
        return new BuildTemplate(builders, provisioners, postProcessors, hooks);
    }

    private static List<ComponentSpec> components(JsonNode section, String label, boolean allowShorthand,
                                                  List<String> errors) {
        List<ComponentSpec> out = new ArrayList<>();
        if (section == null || section.isNull()) {
            return out;
        }
        if (!section.isArray()) {
            errors.add(label + ": expected a list");
            return out;
        }
        int index = 0;
        for (JsonNode element : section) {
            String where = label + "[" + index++ + "]";
            if (allowShorthand && element.isTextual()) {
                out.add(new ComponentSpec(element.asText(), null, null));
                continue;
            }
            if (!element.isObject()) {
                errors.add(where + ": expected an object");
                continue;
            }
            JsonNode type = element.get("type");
            if (type == null || !type.isTextual() || type.asText().isBlank()) {
                errors.add(where + ": 'type' must be specified");
                continue;
            }
            JsonNode name = element.get("name");
            if (name != null && !name.isTextual()) {
                errors.add(where + ": 'name' must be a string");
                continue;
            }
            Map<String, Object> config = MAPPER.convertValue(element, MAP_TYPE);
            config.remove("type");
            config.remove("name");
            try {
                out.add(new ComponentSpec(type.asText(), name != null ? name.asText() : null, ConfigBundle.of(config)));
            } catch (IllegalArgumentException e) {
                errors.add(where + ": " + e.getMessage());
            }
        }
        return out;
    }

    private static Map<String, List<String>> hooks(JsonNode section, List<String> errors) {
        Map<String, List<String>> out = new LinkedHashMap<>();
        if (section == null || section.isNull()) {
            return out;
        }
        if (!section.isObject()) {
            errors.add("hooks: expected an object");
            return out;
        }
        section.fields().forEachRemaining(e -> {
            if (!e.getValue().isArray()) {
                errors.add("hooks." + e.getKey() + ": expected a list of hook types");
                return;
            }
            List<String> types = new ArrayList<>();
            for (JsonNode t : e.getValue()) {
                if (!t.isTextual()) {
                    errors.add("hooks." + e.getKey() + ": expected a list of hook types");
                    return;
                }
                types.add(t.asText());
            }
            out.put(e.getKey(), types);
        });
        return out;
    }
}
