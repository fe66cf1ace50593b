package com.circuit.common.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.circuit.common.dto.Netlist;
import com.circuit.common.dto.NetlistEntry;
import com.circuit.common.exception.NetlistFormatException;
import java.util.List;
import org.junit.jupiter.api.Test;

class NetlistFormatTest {

    @Test
    void parsesLabelsAndNodesInOrder() {
        Netlist netlist = NetlistFormat.parse("R_1 1 2\nC_2 2 3\nV_1 3 1\n");

        assertEquals(3, netlist.size());
        assertEquals("R_1", netlist.get(0).getLabel());
        assertEquals(List.of(1, 2), netlist.get(0).getNodes());
        assertEquals(List.of(3, 1), netlist.get(2).getNodes());
    }

    @Test
    void skipsBlankLinesAndToleratesExtraWhitespace() {
        Netlist netlist = NetlistFormat.parse("\n  R_1   4\t5  \r\n\n\nL_1 5 6");

        assertEquals(2, netlist.size());
        assertEquals(List.of(4, 5), netlist.get(0).getNodes());
        assertEquals("L_1", netlist.get(1).getLabel());
    }

    @Test
    void nullOrEmptyContentYieldsEmptyNetlist() {
        assertTrue(NetlistFormat.parse(null).isEmpty());
        assertTrue(NetlistFormat.parse("   \n").isEmpty());
    }

    @Test
    void rejectsNonIntegerNodeWithLineNumber() {
        NetlistFormatException e = assertThrows(NetlistFormatException.class,
                () -> NetlistFormat.parse("R_1 1 2\n\nC_1 2 x"));

        assertEquals("NETLIST_FORMAT", e.getErrorCode());
        assertTrue(e.getMessage().contains("3"), "Message should name the offending line");
    }

    @Test
    void formatsOneLinePerEntry() {
        Netlist netlist = Netlist.of(NetlistEntry.of("R_1", 1, 2), NetlistEntry.of("GND_SYMBOL"));

        assertEquals("R_1 1 2\nGND_SYMBOL\n", NetlistFormat.format(netlist));
    }

    @Test
    void formattedTextParsesBackToSameEntries() {
        Netlist original = Netlist.of(NetlistEntry.of("Q_1", 3, 1, 2), NetlistEntry.of("R_2", 2, 4));

        Netlist reparsed = NetlistFormat.parse(NetlistFormat.format(original));

        assertEquals(original, reparsed);
    }
}
