package com.circuit.common.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * 单对网表的等价校验报告。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VerificationReport {

    /** 网表文件名（单对比对时可为空） */
    private String name;

    /** 是否拓扑等价 */
    private boolean equivalent;

    /** 标准网表元件数 */
    private int groundTruthComponents;

    /** 待测网表元件数 */
    private int testComponents;

    /** 匹配成功后仍未配对的待测元件数 */
    private int unpairedTestComponents;

    /** 回溯搜索尝试次数 */
    private long searchSteps;

    /** 匹配成功时的节点映射：标准节点 -> 待测节点 */
    private Map<Integer, Integer> nodeMapping;

    /** 解析失败时的错误信息 */
    private String error;
}
