package uk.gegc.aimeter.features.ai.infra.litellm;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Connection settings of the LiteLLM proxy.
 */
@Configuration
@ConfigurationProperties(prefix = "ai.litellm")
@Validated
@Data
public class LiteLlmProperties {

    @NotBlank
    private String baseUrl = "http://localhost:4000";

    /**
     * Proxy key sent as bearer token. Optional for local proxies.
     */
    private String apiKey;

    @NotNull
    private Duration timeout = Duration.ofSeconds(30);

    @DecimalMin("0.0")
    @DecimalMax("2.0")
    private double temperature = 0.7d;

    @Positive
    private int maxTokens = 2048;
}
