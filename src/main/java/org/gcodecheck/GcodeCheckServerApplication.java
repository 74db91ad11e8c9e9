package org.gcodecheck;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

@SpringBootApplication
@ConfigurationPropertiesScan
public class GcodeCheckServerApplication {
    public static void main(String[] args) {
        ensureLogDirectory();
        SpringApplication.run(GcodeCheckServerApplication.class, args);
    }

    /**
     * 提前创建日志目录（logback 的 RollingFileAppender 在目录不存在时会初始化失败）。
     * <p>
     * 与 logback-spring.xml 一致：优先读取系统属性/环境变量 LOG_PATH，默认 ./logs。
     * stdout 是 MCP stdio 通道，这里失败只能输出到 stderr。
     */
    private static void ensureLogDirectory() {
        String logPath = System.getProperty("LOG_PATH");
        if (logPath == null || logPath.isBlank()) {
            logPath = System.getenv("LOG_PATH");
        }
        if (logPath == null || logPath.isBlank()) {
            logPath = "logs";
        }
        try {
            Files.createDirectories(Path.of(logPath));
        } catch (IOException e) {
            System.err.println("无法创建日志目录 " + logPath + "：" + e.getMessage());
        }
    }
}
