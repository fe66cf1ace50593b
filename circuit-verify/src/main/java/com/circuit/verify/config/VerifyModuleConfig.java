package com.circuit.verify.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;

/**
 * 网表校验模块自动配置。
 */
@Configuration
@ComponentScan(basePackages = "com.circuit.verify")
@EnableConfigurationProperties(VerifierProperties.class)
public class VerifyModuleConfig {
}
