package com.example.tscribe_backend.config;

import com.example.tscribe_backend.service.Interfaces.StorageService;
import com.example.tscribe_backend.service.LocalStorageService;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

@EnableConfigurationProperties({StorageProperties.class, CleanupProperties.class})
@Configuration
public class StorageConfig {

    @Bean
    public StorageService storageService(StorageProperties properties) {
        Path base = Path.of(properties.getBaseDir());
        var svc = new LocalStorageService(base, properties.getJobsPrefix());
        LoggerFactory.getLogger(StorageConfig.class)
                .info("Storage wired: base={}, jobsPrefix={}", base, properties.getJobsPrefix());
        return svc;
    }
}
