package com.purchasingpower.forge.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Enables the {@code @ConfigurationProperties} classes that are not themselves components.
 *
 * <p>Enabled configuration classes:
 * <ul>
 *   <li>{@link GeminiConfig} - Google Gemini generation and embedding settings
 * </ul>
 */
@Configuration
@EnableConfigurationProperties({
    GeminiConfig.class
})
public class ConfigurationPropertiesEnablerConfig {
}
