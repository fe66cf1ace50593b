package com.circuit.common.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 元件包围盒，像素坐标 (x1, y1) 为左上角，(x2, y2) 为右下角。
 * JSON 中以 {@code [x1, y1, x2, y2]} 数组形式出现。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonFormat(shape = JsonFormat.Shape.ARRAY)
@JsonPropertyOrder({"x1", "y1", "x2", "y2"})
public class BoundingBox {

    private int x1;

    private int y1;

    private int x2;

    private int y2;

    public int width() {
        return x2 - x1;
    }

    public int height() {
        return y2 - y1;
    }

    /**
     * 面积为零（或坐标倒置）的包围盒。
     */
    public boolean degenerate() {
        return width() <= 0 || height() <= 0;
    }
}
