package com.circuit.common.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 按文件名配对的批量校验结果汇总。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchVerificationReport {

    /** 各文件的校验报告 */
    private List<VerificationReport> reports;

    /** 找不到标准网表而跳过的文件名 */
    private List<String> skipped;

    /** 有标准网表但没有生成网表的文件名 */
    private List<String> missingGenerated;

    /** 实际参与比对的文件数 */
    private int compared;

    /** 判定等价的文件数 */
    private int equivalentCount;

    /** 解析失败的文件数 */
    private int failed;

    /** 等价率（百分比） */
    private double accuracyPercent;
}
