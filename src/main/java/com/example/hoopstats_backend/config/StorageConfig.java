package com.example.hoopstats_backend.config;

import com.example.hoopstats_backend.service.EvaluationHistoryLog;
import com.example.hoopstats_backend.service.Interfaces.FrameStorage;
import com.example.hoopstats_backend.service.Interfaces.SessionStore;
import com.example.hoopstats_backend.service.JsonlSessionStore;
import com.example.hoopstats_backend.service.LocalFrameStorage;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

@EnableConfigurationProperties(StorageProperties.class)
@Configuration
public class StorageConfig {
    private static final Logger LOGGER = LoggerFactory.getLogger(StorageConfig.class);

    @Bean
    public SessionStore sessionStore(StorageProperties properties, ObjectMapper mapper) {
        Path file = Path.of(properties.getBaseDir()).resolve(properties.getSessionsFile());
        LOGGER.info("Session store wired: file={}", file.toAbsolutePath().normalize());
        return new JsonlSessionStore(file, mapper);
    }

    @Bean
    public FrameStorage frameStorage(StorageProperties properties) {
        return new LocalFrameStorage(Path.of(properties.getBaseDir()), properties.getFramesPrefix());
    }

    @Bean
    public EvaluationHistoryLog evaluationHistoryLog(StorageProperties properties, ObjectMapper mapper) {
        return new EvaluationHistoryLog(Path.of(properties.getBaseDir()).resolve(properties.getEvaluationsFile()), mapper);
    }
}
