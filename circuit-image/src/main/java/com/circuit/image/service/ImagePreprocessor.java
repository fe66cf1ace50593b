package com.circuit.image.service;

import com.circuit.common.exception.ImageProcessingException;
import lombok.extern.slf4j.Slf4j;
import org.bytedeco.javacpp.BytePointer;
import org.bytedeco.opencv.global.opencv_imgcodecs;
import org.bytedeco.opencv.opencv_core.Mat;
import org.springframework.stereotype.Service;

import static org.bytedeco.opencv.global.opencv_imgproc.*;

/**
 * 图片编解码与灰度化。
 */
@Slf4j
@Service
public class ImagePreprocessor {

    /**
     * 从字节数组读取图片为 OpenCV Mat（BGR）。
     */
    public Mat readImage(byte[] imageBytes) {
        if (imageBytes == null || imageBytes.length == 0) {
            throw new ImageProcessingException("图片内容为空");
        }
        try {
            Mat raw = opencv_imgcodecs.imdecode(new Mat(imageBytes), opencv_imgcodecs.IMREAD_COLOR);
            if (raw == null || raw.empty()) {
                throw new ImageProcessingException("无法解码图片，请确认图片格式正确");
            }
            log.info("图片读取成功: {}x{}", raw.cols(), raw.rows());
            return raw;
        } catch (ImageProcessingException e) {
            throw e;
        } catch (Exception e) {
            throw new ImageProcessingException("读取图片失败", e);
        }
    }

    /**
     * 灰度化处理。单通道输入直接复制。
     */
    public Mat toGrayscale(Mat src) {
        if (src.channels() == 1) {
            return src.clone();
        }
        Mat gray = new Mat();
        cvtColor(src, gray, src.channels() == 4 ? COLOR_BGRA2GRAY : COLOR_BGR2GRAY);
        return gray;
    }

    /**
     * Mat 转字节数组（PNG 格式）。
     * 使用 JavaCPP 的 BytePointer 重载完成编码。
     */
    public byte[] matToBytes(Mat mat) {
        BytePointer buf = new BytePointer();
        try {
            boolean ok = opencv_imgcodecs.imencode(".png", mat, buf);
            if (!ok || buf.limit() == 0) {
                throw new ImageProcessingException("图片编码为 PNG 失败");
            }
            byte[] result = new byte[(int) buf.limit()];
            buf.get(result);
            return result;
        } finally {
            buf.deallocate();
        }
    }
}
