package org.gcodecheck.program;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * G 码检查服务的 Bean 装配。
 * <p>
 * 检查/修正引擎是纯函数，不需要装配；这里只装配文件访问与两段式写入相关的组件。
 */
@Configuration(proxyBeanMethods = false)
public class GcodeServerConfiguration {

    @Bean
    public SecurePathResolver securePathResolver(GcodeServerProperties properties) {
        return new SecurePathResolver(properties.getRoots(), properties.isAllowSymlink());
    }

    @Bean
    public PendingProgramWriteStore pendingProgramWriteStore(GcodeServerProperties properties) {
        return new PendingProgramWriteStore(
                properties.getPendingWriteTtl(),
                properties.getPendingWriteMaxBytes().toBytes()
        );
    }
}
