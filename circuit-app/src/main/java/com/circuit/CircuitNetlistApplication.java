package com.circuit;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * 电路图网表提取与校验服务 - 启动类。
 */
@SpringBootApplication(scanBasePackages = "com.circuit")
public class CircuitNetlistApplication {

    public static void main(String[] args) {
        SpringApplication.run(CircuitNetlistApplication.class, args);
    }
}
