package com.circuit.common.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 单对网表比对请求，两份网表均为 {@code label node node ...} 文本。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VerifyRequest {

    /** 标准网表 */
    private String groundTruth;

    /** 待测网表 */
    private String test;
}
