package org.gcodecheck.mcp;

import org.springframework.ai.support.ToolCallbacks;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Arrays;
import java.util.List;

/**
 * MCP 工具注册配置：把 {@link GcodeMcpTools} 上的 {@code @Tool} 方法注册为 {@link ToolCallback}，
 * 由 Spring AI MCP Server 通过 MCP 协议暴露给调用方。
 */
@Configuration
public class McpToolConfiguration {

    @Bean
    public List<ToolCallback> gcodeToolCallbacks(GcodeMcpTools tools) {
        return Arrays.asList(ToolCallbacks.from(tools));
    }
}
