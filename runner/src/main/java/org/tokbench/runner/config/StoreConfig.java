package org.tokbench.runner.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.tokbench.common.store.HitRecordStore;

import java.nio.file.Path;

@Configuration
@EnableConfigurationProperties(BenchmarkProperties.class)
public class StoreConfig {

    @Bean(destroyMethod = "close")
    public HitRecordStore hitRecordStore(BenchmarkProperties properties) {
        return HitRecordStore.open(Path.of(properties.getStorePath()));
    }
}
