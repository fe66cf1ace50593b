package com.circuit.image.service;

import com.circuit.common.exception.ImageProcessingException;
import com.circuit.image.config.ImageProperties;
import com.circuit.image.model.LabeledGrid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bytedeco.javacpp.indexer.IntIndexer;
import org.bytedeco.opencv.opencv_core.Mat;
import org.springframework.stereotype.Service;

import static org.bytedeco.opencv.global.opencv_core.CV_32S;
import static org.bytedeco.opencv.global.opencv_imgproc.connectedComponents;

/**
 * 连通区域标记：把导线掩膜中相互连通的像素划成同一个候选节点。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RegionLabeler {

    private final ImageProperties properties;
    private final ImagePreprocessor preprocessor;

    public LabeledGrid labelRegions(Mat mask) {
        int connectivity = properties.getConnectivity();
        if (connectivity != 4 && connectivity != 8) {
            throw new ImageProcessingException("连通性只能是 4 或 8，当前配置: " + connectivity);
        }

        Mat binary = mask.channels() == 1 ? mask : preprocessor.toGrayscale(mask);
        Mat labels = new Mat();
        int count = connectedComponents(binary, labels, connectivity, CV_32S);

        int width = labels.cols();
        int height = labels.rows();
        int[] data = new int[width * height];
        try (IntIndexer indexer = labels.createIndexer()) {
            for (int y = 0; y < height; y++) {
                for (int x = 0; x < width; x++) {
                    data[y * width + x] = indexer.get(y, x);
                }
            }
        }

        // connectedComponents 的返回值包含背景
        log.info("连通区域标记完成: {} 个区域 (连通性={})", Math.max(count - 1, 0), connectivity);
        return new LabeledGrid(width, height, data);
    }
}
