package com.circuit.image.model;

import com.circuit.common.dto.Netlist;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 节点分配结果。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NodeAssignment {

    /** 按区域左上像素重新编号后的网表 */
    private Netlist netlist;

    /** 按引脚处理顺序编号的初始网表 */
    private Netlist provisionalNetlist;

    /** 节点数 */
    private int nodeCount;

    /** 接地节点编号（升序） */
    private List<Integer> groundNodeIds;

    /** 节点锚点，按节点编号升序 */
    private List<NodeAnchor> anchors;

    /** 没有连接任何节点而被丢弃的元件数 */
    private int droppedComponents;

    /** 通过最近导线像素兜底连接的引脚数 */
    private int fallbackTerminals;
}
