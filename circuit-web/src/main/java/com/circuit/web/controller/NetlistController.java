package com.circuit.web.controller;

import com.circuit.common.dto.ApiResponse;
import com.circuit.common.dto.BatchVerificationReport;
import com.circuit.common.dto.DetectedComponent;
import com.circuit.common.dto.ExtractionResult;
import com.circuit.common.dto.VerificationReport;
import com.circuit.common.dto.VerifyRequest;
import com.circuit.common.exception.ImageProcessingException;
import com.circuit.common.exception.NetlistFormatException;
import com.circuit.common.util.ImageUtils;
import com.circuit.image.config.ImageProperties;
import com.circuit.image.service.NetlistExtractionService;
import com.circuit.verify.config.VerifierProperties;
import com.circuit.verify.service.NetlistComparisonService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 网表提取与校验 REST API 控制器。
 * <p>
 * 1. 节点提取：上传电路图和检测器输出的元件 JSON，返回网表
 * 2. 单对校验：提交标准网表与待测网表文本，判断拓扑是否等价
 * 3. 批量校验：上传两组网表文件，按文件名配对比对，返回等价率
 */
@Slf4j
@RestController
@RequestMapping("/api/netlist")
@RequiredArgsConstructor
public class NetlistController {

    private static final TypeReference<List<DetectedComponent>> COMPONENT_LIST = new TypeReference<>() {
    };

    private final NetlistExtractionService extractionService;
    private final NetlistComparisonService comparisonService;
    private final ObjectMapper objectMapper;
    private final ImageProperties imageProperties;
    private final VerifierProperties verifierProperties;

    // ======================== 节点提取 ========================

    /**
     * 从电路图提取网表。
     *
     * @param file       电路图图片
     * @param components 检测器输出的元件数组 JSON（label / bounding_box / connection_points）
     */
    @PostMapping("/extract")
    public ApiResponse<ExtractionResult> extract(
            @RequestParam("file") MultipartFile file,
            @RequestParam("components") String components) {

        log.info("收到提取请求, 文件名: {}, 大小: {} bytes", file.getOriginalFilename(), file.getSize());
        if (!ImageUtils.isImageFile(file.getOriginalFilename())) {
            throw new ImageProcessingException("仅支持 PNG / JPG 格式的电路图: " + file.getOriginalFilename());
        }

        List<DetectedComponent> detected = parseComponents(components);
        ExtractionResult result = extractionService.extract(readBytes(file), detected);
        return ApiResponse.ok(result, "节点提取完成");
    }

    // ======================== 网表校验 ========================

    /**
     * 单对网表等价校验。
     */
    @PostMapping("/verify")
    public ApiResponse<VerificationReport> verify(@RequestBody VerifyRequest request) {
        if (request.getGroundTruth() == null || request.getTest() == null) {
            throw new NetlistFormatException("groundTruth 和 test 都不能为空");
        }
        VerificationReport report = comparisonService.compare(request.getGroundTruth(), request.getTest());
        return ApiResponse.ok(report, report.isEquivalent() ? "网表等价" : "网表不等价");
    }

    /**
     * 批量校验：两组文件按文件名配对。
     */
    @PostMapping("/verify-batch")
    public ApiResponse<BatchVerificationReport> verifyBatch(
            @RequestParam("generated") List<MultipartFile> generated,
            @RequestParam("groundTruth") List<MultipartFile> groundTruth) {

        log.info("收到批量校验请求, 生成网表 {} 个, 标准网表 {} 个", generated.size(), groundTruth.size());
        BatchVerificationReport report = comparisonService.compareBatch(
                readTextFiles(generated), readTextFiles(groundTruth));
        return ApiResponse.ok(report, String.format("等价率 %.2f%%", report.getAccuracyPercent()));
    }

    /**
     * 服务存活检查，附带当前生效的关键配置。
     */
    @GetMapping("/health")
    public ApiResponse<Map<String, Object>> health() {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("status", "UP");
        info.put("connectivity", imageProperties.getConnectivity());
        info.put("dilateIterations", imageProperties.getDilateIterations());
        info.put("nearestEdgeFallback", imageProperties.isNearestEdgeFallbackEnabled());
        info.put("debugArtifacts", imageProperties.isDebugArtifactsEnabled());
        info.put("lockSetMatchNodes", verifierProperties.isLockSetMatchNodes());
        info.put("matchComponentTypes", verifierProperties.isMatchComponentTypes());
        return ApiResponse.ok(info);
    }

    // ======================== 内部方法 ========================

    private List<DetectedComponent> parseComponents(String json) {
        try {
            List<DetectedComponent> components = objectMapper.readValue(json, COMPONENT_LIST);
            return components == null ? List.of() : components;
        } catch (JsonProcessingException e) {
            throw new NetlistFormatException("元件 JSON 格式错误: " + e.getOriginalMessage(), e);
        }
    }

    private byte[] readBytes(MultipartFile file) {
        try {
            return file.getBytes();
        } catch (IOException e) {
            throw new ImageProcessingException("读取上传文件失败", e);
        }
    }

    private Map<String, String> readTextFiles(List<MultipartFile> files) {
        Map<String, String> byName = new LinkedHashMap<>();
        for (MultipartFile file : files) {
            String name = file.getOriginalFilename();
            if (name == null || name.isBlank()) {
                throw new NetlistFormatException("网表文件缺少文件名");
            }
            if (byName.containsKey(name)) {
                log.warn("重复的网表文件名 {}, 以后上传的为准", name);
            }
            try {
                byName.put(name, new String(file.getBytes(), StandardCharsets.UTF_8));
            } catch (IOException e) {
                throw new NetlistFormatException("读取网表文件失败: " + name, e);
            }
        }
        return byName;
    }
}
