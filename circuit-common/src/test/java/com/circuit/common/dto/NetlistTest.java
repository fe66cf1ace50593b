package com.circuit.common.dto;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class NetlistTest {

    @Test
    void keepsEntriesInGivenOrder() {
        Netlist netlist = Netlist.of(NetlistEntry.of("R_2", 2, 3), NetlistEntry.of("R_1", 1, 2));

        assertEquals(2, netlist.size());
        assertFalse(netlist.isEmpty());
        assertEquals("R_2", netlist.get(0).getLabel());
        assertEquals("R_1", netlist.get(1).getLabel());
    }

    @Test
    void entriesCreatedByFactoryCanBeAppended() {
        Netlist netlist = Netlist.of();

        assertTrue(netlist.isEmpty());
        netlist.getEntries().add(NetlistEntry.of("C_1", 1, 2));
        assertEquals(1, netlist.size());
    }

    @Test
    void equalEntriesMakeEqualNetlists() {
        assertEquals(Netlist.of(NetlistEntry.of("R_1", 1, 2)), Netlist.of(NetlistEntry.of("R_1", 1, 2)));
    }
}
