package com.circuit.config;

import com.circuit.image.config.ImageProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bytedeco.javacpp.Loader;
import org.bytedeco.opencv.global.opencv_imgproc;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

/**
 * 应用启动时预加载 OpenCV 本地库，避免第一个请求承担加载耗时，并打印关键参数。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OpenCvInitializer implements CommandLineRunner {

    private final ImageProperties properties;

    @Override
    public void run(String... args) {
        try {
            Loader.load(opencv_imgproc.class);
        } catch (UnsatisfiedLinkError e) {
            log.error("==============================================");
            log.error("  OpenCV 本地库加载失败，节点提取接口不可用");
            log.error("  请确认依赖 opencv-platform 包含当前平台");
            log.error("==============================================");
            throw e;
        }
        log.info("OpenCV 本地库加载完成, Canny={}/{}, 膨胀 {}x{} x{}, 连通性={}",
                properties.getCannyLowThreshold(), properties.getCannyHighThreshold(),
                properties.getDilateKernelSize(), properties.getDilateKernelSize(),
                properties.getDilateIterations(), properties.getConnectivity());
    }
}
