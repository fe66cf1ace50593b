package com.circuit.image.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 节点提取相关配置（边缘检测、膨胀、元件遮挡、引脚连接判定）。
 */
@Data
@ConfigurationProperties(prefix = "circuit.image")
public class ImageProperties {

    /** Canny 滞后阈值下限 */
    private double cannyLowThreshold = 50;

    /** Canny 滞后阈值上限 */
    private double cannyHighThreshold = 150;

    /** 膨胀结构元素边长（像素） */
    private int dilateKernelSize = 5;

    /**
     * 膨胀迭代次数。
     * 越大越能连上手绘断线，但也越容易把相距很近的两根导线粘在一起。
     */
    private int dilateIterations = 2;

    /** 元件遮挡矩形在包围盒长边方向上的内缩量 */
    private int longSideShrink = 12;

    /** 元件遮挡矩形在包围盒短边方向上的内缩量 */
    private int shortSideShrink = 5;

    /** 连通区域标记的连通性：4 或 8 */
    private int connectivity = 4;

    /** 引脚直接连接判定的邻域半径，1 表示 3x3 */
    private int neighborhoodHalfSize = 1;

    /** 邻域内没有导线时，是否退化为全图最近导线像素 */
    private boolean nearestEdgeFallbackEnabled = true;

    /** 接地符号的标签（忽略大小写） */
    private String groundLabel = "GND";

    /** 是否生成调试图（区域着色图、节点标注图、检测标注图） */
    private boolean debugArtifactsEnabled = false;
}
