package com.circuit.common.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 检测器输出的单个元件：类别标签、包围盒和引脚连接点。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DetectedComponent {

    /** 元件标签，如 R_1、C_2、GND */
    private String label;

    @JsonProperty("bounding_box")
    private BoundingBox boundingBox;

    /** 引脚连接点，顺序即引脚顺序 */
    @JsonProperty("connection_points")
    private List<TerminalPoint> connectionPoints;

    /**
     * 是否为接地符号（标签与 groundLabel 忽略大小写相等）。
     */
    public boolean isGround(String groundLabel) {
        return label != null && label.equalsIgnoreCase(groundLabel);
    }

    /**
     * 去掉 (0,0) 补齐点后的连接点列表。
     */
    public List<TerminalPoint> effectiveConnectionPoints() {
        if (connectionPoints == null) {
            return List.of();
        }
        return connectionPoints.stream()
                .filter(p -> p != null && !p.paddingSentinel())
                .toList();
    }
}
