package com.circuit.verify.service;

import com.circuit.common.dto.BatchVerificationReport;
import com.circuit.common.dto.Netlist;
import com.circuit.common.dto.VerificationReport;
import com.circuit.common.exception.NetlistFormatException;
import com.circuit.common.util.NetlistFormat;
import com.circuit.verify.model.MatchResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * 网表比对服务：解析文本网表并调用 {@link EquivalenceVerifier}，支持按文件名批量配对。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NetlistComparisonService {

    private final EquivalenceVerifier verifier;

    /**
     * 比对一对网表文本。格式错误时抛出 {@link NetlistFormatException}。
     */
    public VerificationReport compare(String groundTruthText, String testText) {
        return compare(null, groundTruthText, testText);
    }

    public VerificationReport compare(String name, String groundTruthText, String testText) {
        Netlist groundTruth = NetlistFormat.parse(groundTruthText);
        Netlist test = NetlistFormat.parse(testText);
        MatchResult result = verifier.match(groundTruth, test);

        log.info("比对结果{}: {} (标准 {} 个元件, 待测 {} 个元件, 搜索 {} 步)",
                name == null ? "" : " [" + name + "]",
                result.isEquivalent() ? "等价" : "不等价",
                groundTruth.size(), test.size(), result.getSteps());

        return VerificationReport.builder()
                .name(name)
                .equivalent(result.isEquivalent())
                .groundTruthComponents(groundTruth.size())
                .testComponents(test.size())
                .unpairedTestComponents(result.getUnpairedTestComponents())
                .searchSteps(result.getSteps())
                .nodeMapping(result.getNodeMapping())
                .build();
    }

    /**
     * 按文件名把生成的网表与标准网表配对逐一比对。
     * <p>
     * 找不到标准网表的文件跳过并记录；单个文件解析失败只记入该文件的报告，不影响其他文件。
     *
     * @param generatedByName   文件名 -> 生成的网表文本
     * @param groundTruthByName 文件名 -> 标准网表文本
     */
    public BatchVerificationReport compareBatch(Map<String, String> generatedByName,
                                                Map<String, String> groundTruthByName) {
        List<VerificationReport> reports = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        int equivalent = 0;
        int failed = 0;

        for (Map.Entry<String, String> entry : new TreeMap<>(generatedByName).entrySet()) {
            String name = entry.getKey();
            String groundTruthText = groundTruthByName.get(name);
            if (groundTruthText == null) {
                log.warn("跳过 {}: 找不到对应的标准网表", name);
                skipped.add(name);
                continue;
            }

            try {
                VerificationReport report = compare(name, groundTruthText, entry.getValue());
                reports.add(report);
                if (report.isEquivalent()) {
                    equivalent++;
                }
            } catch (NetlistFormatException e) {
                log.warn("网表解析失败 [{}]: {}", name, e.getMessage());
                failed++;
                reports.add(VerificationReport.builder()
                        .name(name)
                        .error(e.getMessage())
                        .build());
            }
        }

        List<String> missingGenerated = new ArrayList<>();
        for (String name : new TreeMap<>(groundTruthByName).keySet()) {
            if (!generatedByName.containsKey(name)) {
                log.info("标准网表 {} 没有对应的生成网表", name);
                missingGenerated.add(name);
            }
        }

        int compared = reports.size() - failed;
        double accuracy = compared > 0 ? equivalent * 100.0 / compared : 0;
        log.info("批量比对完成: 比对 {} 个, 等价 {} 个, 跳过 {} 个, 解析失败 {} 个, 等价率 {}%",
                compared, equivalent, skipped.size(), failed, String.format("%.2f", accuracy));

        return BatchVerificationReport.builder()
                .reports(reports)
                .skipped(skipped)
                .missingGenerated(missingGenerated)
                .compared(compared)
                .equivalentCount(equivalent)
                .failed(failed)
                .accuracyPercent(accuracy)
                .build();
    }
}
