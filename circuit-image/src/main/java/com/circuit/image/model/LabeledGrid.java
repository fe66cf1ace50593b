package com.circuit.image.model;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 连通区域标记结果：与图片同尺寸的标签网格，0 为背景。
 * <p>
 * 标签数值本身没有顺序含义，只能比较相等；需要稳定顺序时使用 {@link #topLeftPixels()}。
 */
public final class LabeledGrid {

    private final int width;
    private final int height;
    private final int[] labels;

    /** 按行优先顺序排列的非背景像素下标 */
    private final int[] labeledIndices;

    /** 区域标签 -> 该区域行优先顺序下的第一个像素 */
    private final Map<Integer, Pixel> topLeft;

    public LabeledGrid(int width, int height, int[] labels) {
        if (width < 0 || height < 0 || labels.length != width * height) {
            throw new IllegalArgumentException(
                    "标签网格尺寸不匹配: " + width + "x" + height + " vs " + labels.length);
        }
        this.width = width;
        this.height = height;
        this.labels = labels.clone();

        Map<Integer, Pixel> firstPixels = new LinkedHashMap<>();
        int[] indices = new int[labels.length];
        int count = 0;
        for (int i = 0; i < this.labels.length; i++) {
            int label = this.labels[i];
            if (label == 0) {
                continue;
            }
            indices[count++] = i;
            if (!firstPixels.containsKey(label)) {
                firstPixels.put(label, new Pixel(i % width, i / width));
            }
        }
        this.labeledIndices = Arrays.copyOf(indices, count);
        this.topLeft = Collections.unmodifiableMap(firstPixels);
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public boolean contains(int x, int y) {
        return x >= 0 && y >= 0 && x < width && y < height;
    }

    public int labelAt(int x, int y) {
        return labels[y * width + x];
    }

    /**
     * 非背景区域个数。
     */
    public int regionCount() {
        return topLeft.size();
    }

    /**
     * 非背景像素个数。
     */
    public int labeledPixelCount() {
        return labeledIndices.length;
    }

    /**
     * 第 n 个非背景像素（行优先顺序）在网格中的线性下标。
     */
    public int labeledIndexAt(int n) {
        return labeledIndices[n];
    }

    /**
     * 各区域的左上像素：先比较行 y，再比较列 x。迭代顺序即该排序。
     */
    public Map<Integer, Pixel> topLeftPixels() {
        return topLeft;
    }
}
