package com.circuit.image.service;

import com.circuit.common.dto.BoundingBox;
import com.circuit.common.dto.DetectedComponent;
import com.circuit.image.config.ImageProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Point;
import org.bytedeco.opencv.opencv_core.Scalar;
import org.bytedeco.opencv.opencv_core.Size;
import org.springframework.stereotype.Service;

import java.util.List;

import static org.bytedeco.opencv.global.opencv_core.BORDER_CONSTANT;
import static org.bytedeco.opencv.global.opencv_imgproc.*;

/**
 * 导线掩膜构建：边缘检测 -> 膨胀连线 -> 挖掉元件本体。
 * <p>
 * 元件本体被清零后，同一元件的两个引脚不会因为共用一块轮廓而被判成同一节点，
 * 元件自身的轮廓线也不会被当成导线。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConnectivityMaskBuilder {

    private final ImageProperties properties;
    private final ImagePreprocessor preprocessor;

    /**
     * 完整流程：边缘图 + 元件遮挡。
     */
    public Mat buildMask(Mat image, List<DetectedComponent> components) {
        return maskComponents(buildEdgeMap(image), components);
    }

    /**
     * 灰度化后做 Canny 边缘检测，再用矩形核膨胀，把手绘线条的断口连起来。
     */
    public Mat buildEdgeMap(Mat image) {
        Mat gray = preprocessor.toGrayscale(image);

        Mat edges = new Mat();
        Canny(gray, edges, properties.getCannyLowThreshold(), properties.getCannyHighThreshold());

        int kSize = properties.getDilateKernelSize();
        Mat kernel = getStructuringElement(MORPH_RECT, new Size(kSize, kSize));
        Mat dilated = new Mat();
        dilate(edges, dilated, kernel, new Point(-1, -1),
                properties.getDilateIterations(), BORDER_CONSTANT, morphologyDefaultBorderValue());

        log.debug("边缘图构建完成: {}x{}, 膨胀核={}, 迭代={}",
                dilated.cols(), dilated.rows(), kSize, properties.getDilateIterations());
        return dilated;
    }

    /**
     * 在边缘图副本上把每个元件包围盒内缩后的矩形填成 0。
     */
    public Mat maskComponents(Mat edges, List<DetectedComponent> components) {
        Mat masked = edges.clone();
        int maskedCount = 0;
        for (DetectedComponent component : components) {
            BoundingBox inset = insetBox(component.getBoundingBox(), masked.cols(), masked.rows());
            if (inset == null) {
                log.debug("元件 {} 的包围盒无效或落在图外，跳过遮挡", component.getLabel());
                continue;
            }
            rectangle(masked,
                    new Point(inset.getX1(), inset.getY1()),
                    new Point(inset.getX2(), inset.getY2()),
                    new Scalar(0, 0, 0, 0), FILLED, LINE_8, 0);
            maskedCount++;
        }
        log.debug("元件遮挡完成: {}/{} 个元件", maskedCount, components.size());
        return masked;
    }

    /**
     * 计算遮挡矩形（闭区间像素坐标）。
     * <p>
     * 长边方向内缩 longSideShrink，短边方向内缩 shortSideShrink，正方形两个方向都按长边处理。
     * 坐标先按 max(…, 0) 截断；内缩量超过半边长时两角会交叉，此时按两角重新排序，遮挡交叉出的小矩形。
     * 最后裁剪到图片范围内。只有包围盒面积为零或矩形完全落在图外时返回 null。
     */
    public BoundingBox insetBox(BoundingBox box, int imageWidth, int imageHeight) {
        if (box == null || box.degenerate()) {
            return null;
        }
        int width = box.width();
        int height = box.height();
        int shrinkX = width >= height ? properties.getLongSideShrink() : properties.getShortSideShrink();
        int shrinkY = height >= width ? properties.getLongSideShrink() : properties.getShortSideShrink();

        int x1 = Math.max(box.getX1() + shrinkX, 0);
        int y1 = Math.max(box.getY1() + shrinkY, 0);
        int x2 = Math.max(box.getX2() - shrinkX, 0);
        int y2 = Math.max(box.getY2() - shrinkY, 0);

        // 小元件内缩后会倒置，按两角重新取 min/max，仍然遮挡
        int left = Math.min(x1, x2);
        int top = Math.min(y1, y2);
        int right = Math.max(x1, x2);
        int bottom = Math.max(y1, y2);

        if (left >= imageWidth || top >= imageHeight) {
            return null;
        }
        return new BoundingBox(left, top, Math.min(right, imageWidth - 1), Math.min(bottom, imageHeight - 1));
    }
}
