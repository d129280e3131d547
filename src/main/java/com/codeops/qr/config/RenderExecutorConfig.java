package com.codeops.qr.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Configuration for the bounded worker pool that runs QR rendering.
 * Rendering is CPU-bound, so the pool defaults to one thread per available processor
 * and rejects work once its queue is full instead of growing without bound.
 */
@Configuration
@Slf4j
public class RenderExecutorConfig {

    /**
     * Creates the render executor sized from {@link QrProperties}.
     *
     * @param qrProperties the QR configuration properties
     * @return the initialized executor
     */
    @Bean(name = "qrRenderExecutor", destroyMethod = "shutdown")
    public ThreadPoolTaskExecutor qrRenderExecutor(QrProperties qrProperties) {
        int poolSize = qrProperties.getRenderPoolSize() > 0
                ? qrProperties.getRenderPoolSize()
                : Runtime.getRuntime().availableProcessors();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(Math.max(0, qrProperties.getRenderQueueCapacity()));
        executor.setThreadNamePrefix("qr-render-");
        executor.initialize();

        log.info("QR render pool started with {} workers and queue capacity {}",
                poolSize, qrProperties.getRenderQueueCapacity());
        return executor;
    }
}
