package com.circuit.common.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 元件引脚连接点，JSON 中以 {@code [x, y]} 数组形式出现。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonFormat(shape = JsonFormat.Shape.ARRAY)
@JsonPropertyOrder({"x", "y"})
public class TerminalPoint {

    private int x;

    private int y;

    /**
     * 检测器用 (0,0) 补齐关键点数组，原点处的点不是合法引脚。
     */
    public boolean paddingSentinel() {
        return x == 0 && y == 0;
    }
}
