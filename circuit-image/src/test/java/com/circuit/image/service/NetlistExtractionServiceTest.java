package com.circuit.image.service;

import static org.bytedeco.opencv.global.opencv_core.CV_8UC3;
import static org.bytedeco.opencv.global.opencv_imgproc.LINE_8;
import static org.bytedeco.opencv.global.opencv_imgproc.line;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.circuit.common.dto.BoundingBox;
import com.circuit.common.dto.DetectedComponent;
import com.circuit.common.dto.ExtractionResult;
import com.circuit.common.dto.TerminalPoint;
import com.circuit.common.exception.ImageProcessingException;
import com.circuit.common.exception.NetlistFormatException;
import com.circuit.common.util.ImageUtils;
import com.circuit.image.config.ImageProperties;
import java.util.ArrayList;
import java.util.List;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Point;
import org.bytedeco.opencv.opencv_core.Scalar;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * 端到端提取测试。测试图为两条水平导线，上方导线被开关 S_1 的本体截断：
 * <pre>
 *   ----R_1----[S_1]----C_1----   y = 30
 *       |                 |
 *   -------------------------GND  y = 90
 * </pre>
 */
class NetlistExtractionServiceTest {

    private ImageProperties properties;
    private ImagePreprocessor preprocessor;
    private NetlistExtractionService service;

    @BeforeEach
    void setUp() {
        properties = new ImageProperties();
        preprocessor = new ImagePreprocessor();
        service = new NetlistExtractionService(properties, preprocessor,
                new ConnectivityMaskBuilder(properties, preprocessor),
                new RegionLabeler(properties, preprocessor),
                new NodeAssigner(properties),
                new DebugArtifactRenderer());
    }

    @Test
    void extractsNodesFromDrawnCircuit() {
        ExtractionResult result = service.extract(preprocessor.matToBytes(drawCircuit()), circuitComponents());

        assertEquals(200, result.getWidth());
        assertEquals(120, result.getHeight());
        assertEquals(3, result.getRegionCount());
        assertEquals(3, result.getNodeCount());
        assertEquals("R_1 1 3\nC_1 2 3\nS_1 1 2\n", result.getNetlistText());
        assertEquals("R_1 1 2\nC_1 3 2\nS_1 1 3\n", result.getProvisionalNetlistText());
        assertEquals(List.of(3), result.getGroundNodeIds());
        assertEquals(0, result.getDroppedComponents());
        assertTrue(result.getId().startsWith("net-"));
        assertNull(result.getRegionImageBase64());
    }

    @Test
    void detectionOrderDoesNotChangeCanonicalNumbering() {
        List<DetectedComponent> components = circuitComponents();
        List<DetectedComponent> reordered = List.of(components.get(3), components.get(2),
                components.get(0), components.get(1));

        ExtractionResult result = service.extract(drawCircuit(), reordered);

        assertEquals("S_1 1 2\nR_1 1 3\nC_1 2 3\n", result.getNetlistText());
    }

    @Test
    void debugArtifactsAreEncodedWhenEnabled() {
        properties.setDebugArtifactsEnabled(true);

        ExtractionResult result = service.extract(drawCircuit(), circuitComponents());

        assertNotNull(result.getRegionImageBase64());
        assertNotNull(result.getAnnotatedImageBase64());
        Mat nodes = preprocessor.readImage(ImageUtils.fromBase64(result.getLabeledNodesImageBase64()));
        assertEquals(200, nodes.cols());
        assertEquals(120, nodes.rows());
    }

    @Test
    void blankImageDropsAllComponents() {
        Mat blank = new Mat(120, 200, CV_8UC3, new Scalar(255, 255, 255, 0));

        ExtractionResult result = service.extract(blank, circuitComponents());

        assertEquals(0, result.getRegionCount());
        assertEquals("", result.getNetlistText());
        assertEquals(3, result.getDroppedComponents());
        assertTrue(result.getGroundNodeIds().isEmpty());
    }

    @Test
    void missingComponentListIsTreatedAsEmpty() {
        ExtractionResult result = service.extract(drawCircuit(), null);

        assertEquals(2, result.getRegionCount());
        assertEquals(0, result.getNodeCount());
    }

    @Test
    void rejectsLabelContainingWhitespace() {
        List<DetectedComponent> components = List.of(DetectedComponent.builder()
                .label("R 1")
                .connectionPoints(List.of(new TerminalPoint(60, 30)))
                .build());

        assertThrows(NetlistFormatException.class, () -> service.extract(drawCircuit(), components));
    }

    @Test
    void rejectsUndecodableImage() {
        assertThrows(ImageProcessingException.class,
                () -> service.extract(new byte[]{1, 2, 3, 4}, List.of()));
        assertThrows(ImageProcessingException.class,
                () -> service.extract(new byte[0], List.of()));
    }

    private static Mat drawCircuit() {
        Mat image = new Mat(120, 200, CV_8UC3, new Scalar(255, 255, 255, 0));
        Scalar black = new Scalar(0, 0, 0, 0);
        line(image, new Point(20, 30), new Point(180, 30), black, 3, LINE_8, 0);
        line(image, new Point(20, 90), new Point(180, 90), black, 3, LINE_8, 0);
        return image;
    }

    private static List<DetectedComponent> circuitComponents() {
        return List.of(
                component("R_1", new BoundingBox(50, 40, 70, 80), 60, 30, 60, 90),
                component("C_1", new BoundingBox(130, 40, 150, 80), 140, 30, 140, 90),
                component("S_1", new BoundingBox(80, 10, 120, 50), 80, 30, 120, 30),
                component("GND", null, 100, 98));
    }

    private static DetectedComponent component(String label, BoundingBox box, int... xy) {
        List<TerminalPoint> points = new ArrayList<>();
        for (int i = 0; i + 1 < xy.length; i += 2) {
            points.add(new TerminalPoint(xy[i], xy[i + 1]));
        }
        return DetectedComponent.builder().label(label).boundingBox(box).connectionPoints(points).build();
    }
}
