package com.circuit.image.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;

/**
 * 节点提取模块配置：扫描图像处理服务并绑定 circuit.image.* 参数。
 */
@Configuration
@ComponentScan(basePackages = "com.circuit.image")
@EnableConfigurationProperties(ImageProperties.class)
public class ImageModuleConfig {
}
