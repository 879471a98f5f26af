package com.kiln.cli;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class KilnMainTest {

    @Test
    void machineReadableFlagIsRemovedWhereverItAppears() {
        KilnMain.Invocation invocation = KilnMain.parse(List.of("build", "-machine-readable", "t.json"));

        assertTrue(invocation.machineReadable());
        assertEquals(List.of("build", "t.json"), invocation.args());
    }

    @Test
    void otherArgumentsPassThroughInOrder() {
        KilnMain.Invocation invocation = KilnMain.parse(List.of("-h", "build", "-parallel-builds=2"));

        assertFalse(invocation.machineReadable());
        assertEquals(List.of("-h", "build", "-parallel-builds=2"), invocation.args());
    }
}
