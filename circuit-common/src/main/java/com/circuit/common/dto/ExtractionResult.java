package com.circuit.common.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 单张电路图的节点提取结果。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExtractionResult {

    /** 提取任务ID */
    private String id;

    /** 图片宽度（像素） */
    private int width;

    /** 图片高度（像素） */
    private int height;

    /** 掩膜中连通区域总数（不含背景） */
    private int regionCount;

    /** 电气节点数 */
    private int nodeCount;

    /** 接地节点编号 */
    private List<Integer> groundNodeIds;

    /** 规范编号后的网表 */
    private Netlist netlist;

    /** 规范网表的文本形式（label node node ...） */
    private String netlistText;

    /** 按引脚处理顺序编号的初始网表文本，便于排查 */
    private String provisionalNetlistText;

    /** 因没有任何连接节点而被丢弃的元件数 */
    private int droppedComponents;

    /** 通过最近边缘像素兜底连接的引脚数 */
    private int fallbackTerminals;

    /** 处理耗时（毫秒） */
    private long processingTimeMs;

    /** 调试图：连通区域着色图（PNG Base64，未启用时为空） */
    private String regionImageBase64;

    /** 调试图：节点编号标注图（PNG Base64） */
    private String labeledNodesImageBase64;

    /** 调试图：检测结果标注图（PNG Base64） */
    private String annotatedImageBase64;
}
