package com.circuit.common.dto;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class NetlistEntryTest {

    @Test
    void typePrefixIsTextBeforeFirstUnderscore() {
        assertEquals("R", NetlistEntry.of("R_12", 1).typePrefix());
        assertEquals("OPAMP", NetlistEntry.of("OPAMP", 1).typePrefix());
        assertEquals("D", NetlistEntry.of("D_zener_1", 1).typePrefix());
        assertEquals("", new NetlistEntry(null, List.of(1)).typePrefix());
    }

    @Test
    void nodeSetDropsRepeatsButNodeCountDoesNot() {
        NetlistEntry entry = NetlistEntry.of("Q_1", 3, 1, 3);

        assertEquals(Set.of(1, 3), entry.nodeSet());
        assertEquals(List.of(3, 1), List.copyOf(entry.nodeSet()));
        assertEquals(3, entry.nodeCount());
    }
}
