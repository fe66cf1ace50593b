package com.circuit.image.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 像素坐标。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Pixel {

    private int x;

    private int y;
}
