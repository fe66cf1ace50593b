package com.circuit.common.util;

import java.util.Base64;

/**
 * 图片编解码工具类。
 */
public final class ImageUtils {

    private ImageUtils() {
    }

    /**
     * 字节数组转 Base64 字符串。
     */
    public static String toBase64(byte[] imageBytes) {
        return Base64.getEncoder().encodeToString(imageBytes);
    }

    /**
     * Base64 字符串转字节数组。
     */
    public static byte[] fromBase64(String base64) {
        return Base64.getDecoder().decode(base64);
    }

    /**
     * 是否为可识别的图片文件名（按扩展名判断）。
     */
    public static boolean isImageFile(String fileName) {
        if (fileName == null) return false;
        String lower = fileName.toLowerCase();
        return lower.endsWith(".png") || lower.endsWith(".jpg") || lower.endsWith(".jpeg");
    }
}
