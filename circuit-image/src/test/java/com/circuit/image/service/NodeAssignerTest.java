package com.circuit.image.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.circuit.common.dto.DetectedComponent;
import com.circuit.common.dto.TerminalPoint;
import com.circuit.common.util.NetlistFormat;
import com.circuit.image.config.ImageProperties;
import com.circuit.image.model.LabeledGrid;
import com.circuit.image.model.NodeAssignment;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * 节点分配测试，标签网格用字符画构造：数字为区域标签，'.' 为背景。
 */
class NodeAssignerTest {

    private ImageProperties properties;
    private NodeAssigner assigner;

    @BeforeEach
    void setUp() {
        properties = new ImageProperties();
        assigner = new NodeAssigner(properties);
    }

    @Test
    void terminalsOnTwoWiresProduceTwoNodes() {
        LabeledGrid grid = grid(
                "11111111",
                "........",
                "........",
                "22222222");

        NodeAssignment result = assigner.assignNodes(grid, List.of(component("R_1", 2, 0, 2, 3)));

        assertEquals("R_1 1 2\n", NetlistFormat.format(result.getNetlist()));
        assertEquals(2, result.getNodeCount());
        assertEquals(0, result.getFallbackTerminals());
    }

    @Test
    void canonicalIdsFollowTopLeftPixelNotDetectionOrder() {
        LabeledGrid grid = grid(
                "....2222",
                "........",
                "1111....");

        // 第一个引脚落在下方区域，临时编号 1；规范编号按左上像素，上方区域为 1
        NodeAssignment result = assigner.assignNodes(grid, List.of(component("C_1", 1, 2, 5, 0)));

        assertEquals("C_1 2 1\n", NetlistFormat.format(result.getNetlist()));
        assertEquals("C_1 1 2\n", NetlistFormat.format(result.getProvisionalNetlist()));
    }

    @Test
    void rawLabelValuesDoNotAffectNumbering() {
        String[] rows = {
                "1111....3",
                ".......33",
                "222222..3"};
        List<DetectedComponent> components = List.of(
                component("R_1", 8, 2, 0, 2),
                component("R_2", 0, 0, 8, 0));

        NodeAssignment original = assigner.assignNodes(grid(rows), components);
        NodeAssignment relabeled = assigner.assignNodes(grid(relabel(rows, "123", "974")), components);

        assertEquals(original.getNetlist(), relabeled.getNetlist());
        assertEquals("R_1 2 3\nR_2 1 2\n", NetlistFormat.format(original.getNetlist()));
    }

    @Test
    void terminalBesideWireConnectsThroughNeighborhood() {
        LabeledGrid grid = grid(
                "11111",
                ".....",
                ".....",
                ".....",
                "..2..");

        NodeAssignment result = assigner.assignNodes(grid, List.of(component("L_1", 3, 1, 1, 3)));

        assertEquals("L_1 1 2\n", NetlistFormat.format(result.getNetlist()));
        assertEquals(0, result.getFallbackTerminals());
    }

    @Test
    void neighborhoodPrefersCenterThenNearestPixel() {
        LabeledGrid grid = grid(
                "1.2",
                "..3",
                "...");

        assertEquals(3, assigner.findInNeighborhood(grid, 2, 1));
        assertEquals(1, assigner.findInNeighborhood(grid, 1, 0));
        assertEquals(3, assigner.findInNeighborhood(grid, 1, 1));
        assertEquals(0, assigner.findInNeighborhood(grid("....", "....", "...1"), 0, 0));
    }

    @Test
    void distantTerminalFallsBackToNearestWire() {
        LabeledGrid grid = grid(
                "5.........3...",
                "5.........3...",
                "5.........3...",
                "5.........3...",
                "5.........3...",
                "5.........3...");

        NodeAssignment result = assigner.assignNodes(grid,
                List.of(component("D_1", 6, 2, 6, 3), component("D_2", 2, 5, 13, 5)));

        assertEquals("D_1 2\nD_2 1 2\n", NetlistFormat.format(result.getNetlist()));
        assertEquals(4, result.getFallbackTerminals());
        assertEquals(3, assigner.findNearestLabeled(grid, 6, 2));
        assertEquals(3, assigner.findNearestLabeled(grid, 13, 0));
    }

    @Test
    void disabledFallbackDropsUnconnectedComponents() {
        properties.setNearestEdgeFallbackEnabled(false);
        LabeledGrid grid = grid(
                "1.......",
                "1.......",
                "1.......");

        NodeAssignment result = assigner.assignNodes(grid,
                List.of(component("R_1", 6, 1, 7, 2), component("R_2", 0, 1, 1, 2)));

        assertEquals("R_2 1\n", NetlistFormat.format(result.getNetlist()));
        assertEquals(1, result.getDroppedComponents());
        assertEquals(0, result.getFallbackTerminals());
    }

    @Test
    void outOfBoundsTerminalsAreIgnored() {
        LabeledGrid grid = grid(
                "111",
                "...",
                "222");

        NodeAssignment result = assigner.assignNodes(grid, List.of(
                component("R_1", -1, 0, 3, 2, 1, 5),
                component("R_2", 1, 0, 1, 3, 1, 2)));

        assertEquals("R_2 1 2\n", NetlistFormat.format(result.getNetlist()));
        assertEquals(1, result.getDroppedComponents());
    }

    @Test
    void terminalsOnSameRegionCollapseToOneNode() {
        LabeledGrid grid = grid(
                "1111",
                "....",
                "2222");

        NodeAssignment result = assigner.assignNodes(grid, List.of(
                component("R_1", 1, 0, 3, 0),
                component("Q_1", 1, 0, 0, 2, 3, 0)));

        assertEquals("R_1 1\nQ_1 1 2\n", NetlistFormat.format(result.getNetlist()));
    }

    @Test
    void groundMarksNodesWithoutEnteringNetlist() {
        LabeledGrid grid = grid(
                "1111",
                "....",
                "2222",
                "....",
                "3333");

        NodeAssignment result = assigner.assignNodes(grid, List.of(
                component("R_1", 1, 0, 1, 2),
                component("gnd", 3, 2),
                component("GND", 3, 4)));

        assertEquals("R_1 1 2\n", NetlistFormat.format(result.getNetlist()));
        // 只有接地符号触碰的区域不产生节点
        assertEquals(2, result.getNodeCount());
        assertEquals(List.of(2), result.getGroundNodeIds());
    }

    @Test
    void paddingPointAtOriginIsNotATerminal() {
        LabeledGrid grid = grid(
                "1...",
                "....",
                "2222");

        NodeAssignment result = assigner.assignNodes(grid, List.of(component("R_1", 0, 0, 1, 2)));

        assertEquals("R_1 1\n", NetlistFormat.format(result.getNetlist()));
        assertEquals(1, result.getNodeCount());
    }

    @Test
    void emptyMaskDropsEveryComponent() {
        LabeledGrid grid = grid("....", "....");

        NodeAssignment result = assigner.assignNodes(grid, List.of(component("R_1", 1, 1, 2, 1)));

        assertTrue(result.getNetlist().isEmpty());
        assertEquals(0, result.getNodeCount());
        assertEquals(1, result.getDroppedComponents());
    }

    // ======================= 辅助方法 =======================

    private static LabeledGrid grid(String... rows) {
        int height = rows.length;
        int width = rows[0].length();
        int[] labels = new int[width * height];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                char c = rows[y].charAt(x);
                labels[y * width + x] = c == '.' ? 0 : c - '0';
            }
        }
        return new LabeledGrid(width, height, labels);
    }

    private static String[] relabel(String[] rows, String from, String to) {
        return Arrays.stream(rows).map(row -> {
            StringBuilder sb = new StringBuilder();
            for (char c : row.toCharArray()) {
                int i = from.indexOf(c);
                sb.append(i < 0 ? c : to.charAt(i));
            }
            return sb.toString();
        }).toArray(String[]::new);
    }

    /**
     * @param xy 引脚坐标，依次为 x0, y0, x1, y1, ...
     */
    private static DetectedComponent component(String label, int... xy) {
        List<TerminalPoint> points = new ArrayList<>();
        for (int i = 0; i + 1 < xy.length; i += 2) {
            points.add(new TerminalPoint(xy[i], xy[i + 1]));
        }
        return DetectedComponent.builder().label(label).connectionPoints(points).build();
    }
}
