package uk.gegc.aimeter.features.billing.application;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.Optional;

@Service
@RequiredArgsConstructor
public class ModelCatalogService {

    private static final BigDecimal ONE_THOUSAND = BigDecimal.valueOf(1000);

    private final ModelCatalogProperties properties;

    public String defaultModel() {
        return properties.getDefaultModel();
    }

    public String resolveModel(String requested) {
        return requested == null || requested.isBlank() ? properties.getDefaultModel() : requested;
    }

    /**
     * Unknown models are treated as paid.
     */
    public boolean isFreeModel(String model) {
        return model != null && properties.getFreeModels().contains(model);
    }

    /**
     * Cost of a call computed from the configured price table.
     *
     * @return empty when the model has no configured price or token counts are missing
     */
    public Optional<BigDecimal> estimateCostUsd(String model, Integer inputTokens, Integer outputTokens) {
        if (model == null || inputTokens == null || outputTokens == null) {
            return Optional.empty();
        }
        ModelCatalogProperties.ModelPrice price = properties.getPrices().get(model);
        if (price == null) {
            return Optional.empty();
        }
        BigDecimal input = price.getInputUsdPer1kTokens().multiply(BigDecimal.valueOf(inputTokens));
        BigDecimal output = price.getOutputUsdPer1kTokens().multiply(BigDecimal.valueOf(outputTokens));
        return Optional.of(input.add(output).divide(ONE_THOUSAND, MathContext.DECIMAL64));
    }
}
