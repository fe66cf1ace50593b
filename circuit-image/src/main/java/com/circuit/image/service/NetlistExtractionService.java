package com.circuit.image.service;

import com.circuit.common.dto.DetectedComponent;
import com.circuit.common.dto.ExtractionResult;
import com.circuit.common.exception.NetlistFormatException;
import com.circuit.common.util.IdGenerator;
import com.circuit.common.util.ImageUtils;
import com.circuit.common.util.NetlistFormat;
import com.circuit.image.config.ImageProperties;
import com.circuit.image.model.LabeledGrid;
import com.circuit.image.model.NodeAssignment;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bytedeco.opencv.opencv_core.Mat;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * 节点提取流水线：解码 -> 导线掩膜 -> 连通区域标记 -> 节点分配 -> 网表。
 * <p>
 * 每张图片的掩膜、标签网格和节点映射都是本次调用的局部状态，不跨请求缓存。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NetlistExtractionService {

    private final ImageProperties properties;
    private final ImagePreprocessor preprocessor;
    private final ConnectivityMaskBuilder maskBuilder;
    private final RegionLabeler regionLabeler;
    private final NodeAssigner nodeAssigner;
    private final DebugArtifactRenderer renderer;

    /**
     * 从图片字节和检测器输出提取网表。
     */
    public ExtractionResult extract(byte[] imageBytes, List<DetectedComponent> components) {
        return extract(preprocessor.readImage(imageBytes), components);
    }

    public ExtractionResult extract(Mat image, List<DetectedComponent> components) {
        long startTime = System.currentTimeMillis();
        List<DetectedComponent> detected = sanitize(components);
        log.info("开始提取节点: 图片 {}x{}, 元件 {} 个", image.cols(), image.rows(), detected.size());

        Mat edges = maskBuilder.buildEdgeMap(image);
        Mat mask = maskBuilder.maskComponents(edges, detected);
        LabeledGrid grid = regionLabeler.labelRegions(mask);
        NodeAssignment assignment = nodeAssigner.assignNodes(grid, detected);

        ExtractionResult result = ExtractionResult.builder()
                .id(IdGenerator.withPrefix("net"))
                .width(image.cols())
                .height(image.rows())
                .regionCount(grid.regionCount())
                .nodeCount(assignment.getNodeCount())
                .groundNodeIds(assignment.getGroundNodeIds())
                .netlist(assignment.getNetlist())
                .netlistText(NetlistFormat.format(assignment.getNetlist()))
                .provisionalNetlistText(NetlistFormat.format(assignment.getProvisionalNetlist()))
                .droppedComponents(assignment.getDroppedComponents())
                .fallbackTerminals(assignment.getFallbackTerminals())
                .build();

        if (properties.isDebugArtifactsEnabled()) {
            attachDebugArtifacts(result, image, edges, grid, assignment, detected);
        }

        result.setProcessingTimeMs(System.currentTimeMillis() - startTime);
        log.info("节点提取完成 [{}]: {} 个区域, {} 个节点, 网表 {} 行, 耗时 {}ms",
                result.getId(), result.getRegionCount(), result.getNodeCount(),
                assignment.getNetlist().size(), result.getProcessingTimeMs());
        return result;
    }

    private void attachDebugArtifacts(ExtractionResult result, Mat image, Mat edges, LabeledGrid grid,
                                      NodeAssignment assignment, List<DetectedComponent> detected) {
        result.setRegionImageBase64(ImageUtils.toBase64(
                preprocessor.matToBytes(renderer.renderRegions(grid, assignment))));
        result.setLabeledNodesImageBase64(ImageUtils.toBase64(
                preprocessor.matToBytes(renderer.renderNodes(edges, grid, assignment))));
        result.setAnnotatedImageBase64(ImageUtils.toBase64(
                preprocessor.matToBytes(renderer.renderDetections(image, detected))));
        log.debug("调试图已生成 [{}]", result.getId());
    }

    /**
     * 丢弃空记录，校验标签，过滤 (0,0) 补齐点。
     */
    private List<DetectedComponent> sanitize(List<DetectedComponent> components) {
        List<DetectedComponent> cleaned = new ArrayList<>();
        if (components == null) {
            return cleaned;
        }
        for (DetectedComponent component : components) {
            if (component == null) continue;
            String label = component.getLabel() == null ? "" : component.getLabel().strip();
            if (!label.matches("\\S+")) {
                throw new NetlistFormatException("元件标签为空或包含空白字符: '" + label + "'");
            }
            cleaned.add(DetectedComponent.builder()
                    .label(label)
                    .boundingBox(component.getBoundingBox())
                    .connectionPoints(component.effectiveConnectionPoints())
                    .build());
        }
        return cleaned;
    }
}
