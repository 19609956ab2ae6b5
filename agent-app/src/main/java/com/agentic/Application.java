package com.agentic;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Agent 协调核心应用启动类。
 * <p>
 * 位于顶层包路径，确保能够扫描到所有子模块中的组件。
 * </p>
 *
 * @author agentic
 * @since 2026-10-17
 */
@SpringBootApplication
public class Application {

    public static void main(String[] args) {
        SpringApplication.run(Application.class, args);
    }

}
