package com.kiln.internal.components;

import com.kiln.component.Builder;
import com.kiln.component.ComponentKind;
import com.kiln.config.KilnConfig;
import com.kiln.internal.components.builder.NullBuilder;
import com.kiln.plugin.ComponentRegistry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InternalComponentsTest {

    @TempDir
    Path tmp;

    @Test
    void everyKindHasBuiltins() {
        for (ComponentKind kind : ComponentKind.values()) {
            assertFalse(InternalComponents.components(kind).isEmpty(), kind.toString());
        }
        assertEquals(List.of("build", "validate", "version", "plugins", "plugin"),
                List.copyOf(InternalComponents.components(ComponentKind.COMMAND).keySet()));
    }

    @Test
    void factoriesProduceTheirKind() {
        for (ComponentKind kind : ComponentKind.values()) {
            for (Supplier<?> factory : InternalComponents.components(kind).values()) {
                assertInstanceOf(kind.capabilityType(), factory.get());
            }
        }
    }

    @Test
    void registersIntoRegistry() {
        KilnConfig config = KilnConfig.builder().pluginDirectories(List.of(tmp)).systemPath(List.of()).build();
        ComponentRegistry registry = InternalComponents.registerAll(ComponentRegistry.builder(config)).build();

        Builder builder = registry.load(Builder.class, ComponentKind.BUILDER, "null", null);

        assertInstanceOf(NullBuilder.class, builder);
        assertTrue(InternalComponents.lookup(ComponentKind.HOOK, "echo").isPresent());
        assertTrue(InternalComponents.lookup(ComponentKind.HOOK, "nope").isEmpty());
    }
}
