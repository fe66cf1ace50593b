package com.circuit.common.exception;

/**
 * 电路图无法处理：上传的不是图片、解码失败、连通性参数非法等。
 * 错误码固定为 IMG_ERROR。
 */
public class ImageProcessingException extends CircuitException {

    public ImageProcessingException(String message) {
        super("IMG_ERROR", message);
    }

    public ImageProcessingException(String message, Throwable cause) {
        super("IMG_ERROR", message, cause);
    }
}
