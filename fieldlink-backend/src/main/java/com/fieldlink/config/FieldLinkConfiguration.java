package com.fieldlink.config;

import com.fieldlink.model.LinkConfigFile;
import com.fieldlink.relation.PoolSettings;
import com.fieldlink.relation.RelationRegistry;
import com.fieldlink.resolver.FieldRelationIndex;
import com.fieldlink.resolver.GraphResolver;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.server.ConfigurableWebServerFactory;
import org.springframework.boot.web.server.WebServerFactoryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.ResourceUtils;

import java.io.FileNotFoundException;
import java.nio.file.Path;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Startup wiring: schema, relation pools, index and resolver are built once and shared by all requests.
 * Any failure here (invalid schema, unreachable relation) aborts the application before it serves traffic.
 */
@Slf4j
@Configuration
public class FieldLinkConfiguration {

    @Value("${fieldlink.config-path:config.yaml}")
    private String configPath;

    @Value("${fieldlink.resolver.max-depth:10}")
    private int maxDepth;

    @Value("${fieldlink.resolver.lookup-threads:8}")
    private int lookupThreads;

    @Value("${fieldlink.resolver.request-timeout-ms:30000}")
    private long requestTimeoutMs;

    @Value("${fieldlink.pool.maximum-pool-size:5}")
    private int maximumPoolSize;

    @Value("${fieldlink.pool.connection-timeout-ms:5000}")
    private long connectionTimeoutMs;

    @Bean
    public LinkConfigFile linkConfig() {
        Path path;
        try {
            path = ResourceUtils.getFile(configPath).toPath();
        } catch (FileNotFoundException e) {
            throw new ConfigException("config file not found: " + configPath, e);
        }
        return new LinkConfigLoader().load(path);
    }

    @Bean(destroyMethod = "close")
    public RelationRegistry relationRegistry(LinkConfigFile linkConfig) {
        PoolSettings poolSettings = PoolSettings.builder()
                .maximumPoolSize(maximumPoolSize)
                .connectionTimeoutMs(connectionTimeoutMs)
                .build();
        return new RelationRegistry(linkConfig.getRelations(), poolSettings);
    }

    @Bean
    public FieldRelationIndex fieldRelationIndex(LinkConfigFile linkConfig, RelationRegistry relationRegistry) {
        FieldRelationIndex index = new FieldRelationIndex(linkConfig.getFields(), relationRegistry.getAdapters());
        log.info("Field index ready: {} fields over {} relations", linkConfig.getFields().size(), index.relationCount());
        return index;
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService lookupExecutor() {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, "fieldlink-lookup-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newFixedThreadPool(lookupThreads, threadFactory);
    }

    @Bean
    public GraphResolver graphResolver(FieldRelationIndex fieldRelationIndex, ExecutorService lookupExecutor) {
        log.info("Resolver ready: max_depth={}, lookup_threads={}, request_timeout_ms={}",
                maxDepth, lookupThreads, requestTimeoutMs);
        return new GraphResolver(fieldRelationIndex, lookupExecutor, maxDepth, requestTimeoutMs);
    }

    @Bean
    public WebServerFactoryCustomizer<ConfigurableWebServerFactory> listenAddressCustomizer(LinkConfigFile linkConfig) {
        return factory -> {
            if (linkConfig.getListen() == null || linkConfig.getListen().isBlank()) {
                return;
            }
            ListenAddress listen = ListenAddress.parse(linkConfig.getListen());
            factory.setAddress(listen.toInetAddress());
            factory.setPort(listen.getPort());
            log.info("Starting HTTP server on {}", listen);
        };
    }
}
