package com.circuit.image.service;

import com.circuit.common.dto.DetectedComponent;
import com.circuit.common.dto.Netlist;
import com.circuit.common.dto.NetlistEntry;
import com.circuit.common.dto.TerminalPoint;
import com.circuit.image.config.ImageProperties;
import com.circuit.image.model.LabeledGrid;
import com.circuit.image.model.NodeAnchor;
import com.circuit.image.model.NodeAssignment;
import com.circuit.image.model.Pixel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 节点分配：把每个元件引脚映射到它接触的连通区域，同一区域上的引脚合并为一个电气节点。
 * <p>
 * 流程：
 * 1. 引脚 3x3 邻域内有导线像素 → 直接连接该区域
 * 2. 邻域内没有 → 取全图欧氏距离最近的导线像素所在区域（关键点常偏离线条 1~3 像素）
 * 3. 第一遍按引脚处理顺序给区域分配临时编号
 * 4. 第二遍按区域左上像素（先行后列）重新编号，使编号与元件检测顺序无关
 * <p>
 * 接地符号不进入网表，也不单独产生节点，只用来标记哪些节点是地。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NodeAssigner {

    private final ImageProperties properties;

    public NodeAssignment assignNodes(LabeledGrid grid, List<DetectedComponent> components) {
        String groundLabel = properties.getGroundLabel();

        // ==================== 第一遍：引脚 -> 区域 ====================
        Map<Integer, Integer> provisionalIds = new LinkedHashMap<>();
        List<ResolvedComponent> resolved = new ArrayList<>();
        Set<Integer> groundRegions = new HashSet<>();
        int fallbackTerminals = 0;

        for (DetectedComponent component : components) {
            boolean ground = component.isGround(groundLabel);
            Set<Integer> regions = new LinkedHashSet<>();

            for (TerminalPoint point : component.effectiveConnectionPoints()) {
                if (!grid.contains(point.getX(), point.getY())) {
                    log.debug("元件 {} 的引脚 ({}, {}) 超出图片范围，跳过",
                            component.getLabel(), point.getX(), point.getY());
                    continue;
                }
                int region = findInNeighborhood(grid, point.getX(), point.getY());
                if (region == 0 && properties.isNearestEdgeFallbackEnabled()) {
                    region = findNearestLabeled(grid, point.getX(), point.getY());
                    if (region != 0) {
                        fallbackTerminals++;
                    }
                }
                if (region != 0) {
                    regions.add(region);
                }
            }

            if (ground) {
                groundRegions.addAll(regions);
                continue;
            }
            for (Integer region : regions) {
                provisionalIds.putIfAbsent(region, provisionalIds.size() + 1);
            }
            resolved.add(new ResolvedComponent(component.getLabel(), new ArrayList<>(regions)));
        }

        // ==================== 第二遍：按左上像素重新编号 ====================
        // topLeftPixels 的迭代顺序就是 (y, x) 排序
        Map<Integer, Integer> canonicalIds = new LinkedHashMap<>();
        List<NodeAnchor> anchors = new ArrayList<>();
        for (Map.Entry<Integer, Pixel> entry : grid.topLeftPixels().entrySet()) {
            int region = entry.getKey();
            if (!provisionalIds.containsKey(region)) {
                continue;
            }
            int nodeId = canonicalIds.size() + 1;
            canonicalIds.put(region, nodeId);
            anchors.add(NodeAnchor.builder()
                    .nodeId(nodeId)
                    .regionLabel(region)
                    .topLeft(entry.getValue())
                    .ground(groundRegions.contains(region))
                    .build());
        }

        // ==================== 输出网表 ====================
        List<NetlistEntry> canonical = new ArrayList<>();
        List<NetlistEntry> provisional = new ArrayList<>();
        int dropped = 0;
        for (ResolvedComponent component : resolved) {
            String label = component.label;
            List<Integer> regions = component.regions;
            if (regions.isEmpty()) {
                log.debug("元件 {} 没有连接任何节点，不写入网表", label);
                dropped++;
                continue;
            }
            canonical.add(new NetlistEntry(label, mapRegions(regions, canonicalIds)));
            provisional.add(new NetlistEntry(label, mapRegions(regions, provisionalIds)));
        }

        List<Integer> groundNodeIds = anchors.stream()
                .filter(NodeAnchor::isGround)
                .map(NodeAnchor::getNodeId)
                .toList();

        log.info("节点分配完成: {} 个节点, {} 个元件写入网表, {} 个被丢弃, 兜底连接引脚 {} 个, 接地节点 {}",
                canonicalIds.size(), canonical.size(), dropped, fallbackTerminals, groundNodeIds);

        return NodeAssignment.builder()
                .netlist(new Netlist(canonical))
                .provisionalNetlist(new Netlist(provisional))
                .nodeCount(canonicalIds.size())
                .groundNodeIds(groundNodeIds)
                .anchors(anchors)
                .droppedComponents(dropped)
                .fallbackTerminals(fallbackTerminals)
                .build();
    }

    private List<Integer> mapRegions(List<Integer> regions, Map<Integer, Integer> ids) {
        List<Integer> nodes = new ArrayList<>(regions.size());
        for (Integer region : regions) {
            nodes.add(ids.get(region));
        }
        return nodes;
    }

    // ============================ 引脚连接判定 ============================

    /**
     * 在引脚周围 (2h+1)x(2h+1) 的邻域里找导线像素。
     * 中心像素有标签时直接取中心；否则取离中心最近的，距离相同按行优先顺序。
     *
     * @return 区域标签，邻域内没有导线时返回 0
     */
    int findInNeighborhood(LabeledGrid grid, int px, int py) {
        int center = grid.labelAt(px, py);
        if (center != 0) {
            return center;
        }
        int half = properties.getNeighborhoodHalfSize();
        int yStart = Math.max(0, py - half);
        int yEnd = Math.min(grid.getHeight() - 1, py + half);
        int xStart = Math.max(0, px - half);
        int xEnd = Math.min(grid.getWidth() - 1, px + half);

        int best = 0;
        int bestDist = Integer.MAX_VALUE;
        for (int y = yStart; y <= yEnd; y++) {
            for (int x = xStart; x <= xEnd; x++) {
                int label = grid.labelAt(x, y);
                if (label == 0) continue;
                int dist = (x - px) * (x - px) + (y - py) * (y - py);
                if (dist < bestDist) {
                    bestDist = dist;
                    best = label;
                }
            }
        }
        return best;
    }

    /**
     * 全图欧氏距离最近的导线像素所在区域，距离相同取行优先顺序中靠前的。
     *
     * @return 区域标签，掩膜中没有任何导线时返回 0
     */
    int findNearestLabeled(LabeledGrid grid, int px, int py) {
        int width = grid.getWidth();
        int best = 0;
        long bestDist = Long.MAX_VALUE;
        for (int n = 0; n < grid.labeledPixelCount(); n++) {
            int index = grid.labeledIndexAt(n);
            long dx = index % width - px;
            long dy = index / width - py;
            long dist = dx * dx + dy * dy;
            if (dist < bestDist) {
                bestDist = dist;
                best = grid.labelAt(index % width, index / width);
            }
        }
        return best;
    }

    /**
     * 第一遍的中间结果：元件标签及其按引脚顺序去重后的区域标签。
     */
    private static final class ResolvedComponent {

        private final String label;
        private final List<Integer> regions;

        private ResolvedComponent(String label, List<Integer> regions) {
            this.label = label;
            this.regions = regions;
        }
    }
}
