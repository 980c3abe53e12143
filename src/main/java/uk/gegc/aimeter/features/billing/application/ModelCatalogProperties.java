package uk.gegc.aimeter.features.billing.application;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Model catalog: default model, zero-cost models and optional per-token prices for providers
 * that do not report cost themselves.
 */
@Configuration
@ConfigurationProperties(prefix = "ai.models")
@Validated
@Data
public class ModelCatalogProperties {

    @NotBlank
    private String defaultModel = "gpt-4o-mini";

    /**
     * Models billed at zero credits.
     */
    private List<String> freeModels = new ArrayList<>();

    /**
     * Per-model token prices keyed by model id.
     */
    private Map<String, ModelPrice> prices = new HashMap<>();

    @Data
    public static class ModelPrice {
        private BigDecimal inputUsdPer1kTokens = BigDecimal.ZERO;
        private BigDecimal outputUsdPer1kTokens = BigDecimal.ZERO;
    }
}
