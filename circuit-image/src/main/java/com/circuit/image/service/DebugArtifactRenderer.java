package com.circuit.image.service;

import com.circuit.common.dto.BoundingBox;
import com.circuit.common.dto.DetectedComponent;
import com.circuit.common.dto.TerminalPoint;
import com.circuit.image.model.LabeledGrid;
import com.circuit.image.model.NodeAnchor;
import com.circuit.image.model.NodeAssignment;
import lombok.extern.slf4j.Slf4j;
import org.bytedeco.javacpp.indexer.UByteIndexer;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Point;
import org.bytedeco.opencv.opencv_core.Scalar;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.bytedeco.opencv.global.opencv_core.CV_8UC3;
import static org.bytedeco.opencv.global.opencv_imgproc.*;

/**
 * 调试图绘制，仅供人工检查，不影响网表结果。
 */
@Slf4j
@Service
public class DebugArtifactRenderer {

    /** 区域着色调色板（BGR），20 种可区分的颜色 */
    private static final int[][] PALETTE = {
            {180, 119, 31}, {232, 199, 174}, {14, 127, 255}, {120, 187, 255},
            {44, 160, 44}, {138, 223, 152}, {40, 39, 214}, {150, 152, 255},
            {189, 103, 148}, {213, 176, 197}, {75, 86, 140}, {148, 156, 196},
            {194, 119, 227}, {210, 182, 247}, {127, 127, 127}, {199, 199, 199},
            {34, 189, 188}, {141, 219, 219}, {207, 190, 23}, {229, 218, 158}
    };

    private static final int[] GROUND_COLOR = {255, 255, 255};
    private static final int[] NODE_COLOR = {0, 0, 255};

    /**
     * 连通区域着色图：接地区域为白色，其余节点区域按调色板着色，区域中心标注节点编号。
     */
    public Mat renderRegions(LabeledGrid grid, NodeAssignment assignment) {
        Map<Integer, int[]> colors = new HashMap<>();
        for (NodeAnchor anchor : assignment.getAnchors()) {
            colors.put(anchor.getRegionLabel(), anchor.isGround()
                    ? GROUND_COLOR
                    : PALETTE[anchor.getRegionLabel() % PALETTE.length]);
        }

        Mat image = new Mat(grid.getHeight(), grid.getWidth(), CV_8UC3, new Scalar(0, 0, 0, 0));
        paintRegions(image, grid, colors);

        Map<Integer, long[]> sums = regionSums(grid);
        for (NodeAnchor anchor : assignment.getAnchors()) {
            long[] sum = sums.get(anchor.getRegionLabel());
            if (sum == null || sum[2] == 0) continue;
            Point center = new Point((int) (sum[0] / sum[2]), (int) (sum[1] / sum[2]));
            drawOutlinedText(image, String.valueOf(anchor.getNodeId()), center);
        }
        return image;
    }

    /**
     * 节点标注图：在未遮挡的边缘图上标出节点区域，并在每个节点的左上像素处画红点和编号。
     */
    public Mat renderNodes(Mat edges, LabeledGrid grid, NodeAssignment assignment) {
        Mat image = new Mat();
        cvtColor(edges, image, COLOR_GRAY2BGR);

        Map<Integer, int[]> colors = new HashMap<>();
        for (NodeAnchor anchor : assignment.getAnchors()) {
            colors.put(anchor.getRegionLabel(), NODE_COLOR);
        }
        paintRegions(image, grid, colors);

        for (NodeAnchor anchor : assignment.getAnchors()) {
            Point topLeft = new Point(anchor.getTopLeft().getX(), anchor.getTopLeft().getY());
            circle(image, topLeft, 7, new Scalar(0, 0, 255, 0), FILLED, LINE_8, 0);
            drawOutlinedText(image, String.valueOf(anchor.getNodeId()), topLeft);
        }
        return image;
    }

    /**
     * 检测结果标注图：绿色包围盒、标签文字、蓝色引脚点。
     */
    public Mat renderDetections(Mat source, List<DetectedComponent> components) {
        Mat image = source.clone();
        for (DetectedComponent component : components) {
            BoundingBox box = component.getBoundingBox();
            if (box != null) {
                rectangle(image, new Point(box.getX1(), box.getY1()), new Point(box.getX2(), box.getY2()),
                        new Scalar(0, 255, 0, 0), 2, LINE_8, 0);
                putText(image, String.valueOf(component.getLabel()), new Point(box.getX1(), box.getY1() - 10),
                        FONT_HERSHEY_SIMPLEX, 0.5, new Scalar(255, 0, 0, 0), 1, LINE_8, false);
            }
            for (TerminalPoint point : component.effectiveConnectionPoints()) {
                circle(image, new Point(point.getX(), point.getY()), 5,
                        new Scalar(255, 0, 0, 0), FILLED, LINE_8, 0);
            }
        }
        return image;
    }

    private void paintRegions(Mat image, LabeledGrid grid, Map<Integer, int[]> colors) {
        try (UByteIndexer indexer = image.createIndexer()) {
            for (int y = 0; y < grid.getHeight(); y++) {
                for (int x = 0; x < grid.getWidth(); x++) {
                    int[] bgr = colors.get(grid.labelAt(x, y));
                    if (bgr == null) continue;
                    for (int c = 0; c < 3; c++) {
                        indexer.put(y, x, c, bgr[c]);
                    }
                }
            }
        }
    }

    /**
     * 每个区域的像素坐标和与像素数：{sumX, sumY, count}。
     */
    private Map<Integer, long[]> regionSums(LabeledGrid grid) {
        Map<Integer, long[]> sums = new HashMap<>();
        for (int n = 0; n < grid.labeledPixelCount(); n++) {
            int index = grid.labeledIndexAt(n);
            int x = index % grid.getWidth();
            int y = index / grid.getWidth();
            long[] sum = sums.computeIfAbsent(grid.labelAt(x, y), k -> new long[3]);
            sum[0] += x;
            sum[1] += y;
            sum[2]++;
        }
        return sums;
    }

    /**
     * 黑色描边 + 白色文字，在任何底色上都清晰可见。
     */
    private void drawOutlinedText(Mat image, String text, Point origin) {
        putText(image, text, origin, FONT_HERSHEY_SIMPLEX, 0.5, new Scalar(0, 0, 0, 0), 3, LINE_AA, false);
        putText(image, text, origin, FONT_HERSHEY_SIMPLEX, 0.5, new Scalar(255, 255, 255, 0), 1, LINE_AA, false);
    }
}
