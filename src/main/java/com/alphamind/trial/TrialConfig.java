package com.alphamind.trial;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Locale;

@Configuration
public class TrialConfig {

    private static final Logger log = LoggerFactory.getLogger(TrialConfig.class);

    /**
     * Picks the launcher for the host platform once, at startup.
     * {@code alphamind.trial.platform} overrides the detection.
     */
    @Bean
    public TrialExecutor trialExecutor(TrialProperties properties) {
        String platform = resolvePlatform(properties.getPlatform(), System.getProperty("os.name", ""));
        log.info("Using {} trial executor", platform);
        return "windows".equals(platform)
                ? new WindowsTrialExecutor(properties.getExtraPath())
                : new PosixTrialExecutor(properties.getExtraPath());
    }

    static String resolvePlatform(String configured, String osName) {
        String value = configured == null ? "auto" : configured.trim().toLowerCase(Locale.ROOT);
        return switch (value) {
            case "posix", "windows" -> value;
            case "auto", "" -> osName.toLowerCase(Locale.ROOT).startsWith("windows") ? "windows" : "posix";
            default -> throw new IllegalArgumentException("Unknown alphamind.trial.platform: " + configured);
        };
    }
}
