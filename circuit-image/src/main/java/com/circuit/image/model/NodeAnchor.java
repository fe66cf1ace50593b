package com.circuit.image.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 电气节点与其所在区域的对应关系。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NodeAnchor {

    /** 规范节点编号（从 1 开始） */
    private int nodeId;

    /** 标记阶段给出的区域标签 */
    private int regionLabel;

    /** 区域左上像素，节点编号按它排序 */
    private Pixel topLeft;

    /** 是否有接地符号连在该区域上 */
    private boolean ground;
}
