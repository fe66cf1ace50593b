package com.circuit.verify.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * 一次等价校验的结果。只报告找到的第一个解，不在多个解之间择优。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MatchResult {

    private boolean equivalent;

    /** 标准节点 -> 待测节点，成功时捕获，失败时为空 */
    private Map<Integer, Integer> nodeMapping;

    /** 第 i 个标准元件配对到的待测元件下标，失败时为空 */
    private List<Integer> pairing;

    /** 搜索中检查过的候选数 */
    private long steps;

    /** 成功时未被配对的待测元件数 */
    private int unpairedTestComponents;
}
