package com.circuit.verify.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 网表等价校验配置项。
 */
@Data
@ConfigurationProperties(prefix = "circuit.verifier")
public class VerifierProperties {

    /**
     * 集合匹配（节点编号原样相同）成功后，是否把 n -> n 的映射锁定。
     * 关闭后集合匹配不约束后续元件，同一个标准节点可能被后面的位置匹配映射到别的待测节点。
     */
    private boolean lockSetMatchNodes = true;

    /** 是否要求配对的两个元件类型前缀（下划线之前的部分）一致 */
    private boolean matchComponentTypes = false;

    /** 是否以 DEBUG 级别输出每一步搜索轨迹 */
    private boolean traceEnabled = false;
}
