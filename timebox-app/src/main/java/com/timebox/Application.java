package com.timebox;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Timebox 任务与排程服务启动类。
 * <p>
 * 位于顶层包路径，扫描 trigger 与 infrastructure 模块中的全部组件。
 * </p>
 */
@SpringBootApplication
public class Application {

    public static void main(String[] args) {
        SpringApplication.run(Application.class, args);
    }
}
