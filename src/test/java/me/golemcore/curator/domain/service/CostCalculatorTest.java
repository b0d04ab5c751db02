package me.golemcore.curator.domain.service;

import me.golemcore.curator.domain.model.ModelCapability;
import me.golemcore.curator.domain.model.ProviderConfig;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CostCalculatorTest {

    private final CostCalculator calculator = new CostCalculator();

    @Test
    void pricesByModelRates() {
        ProviderConfig provider = ProviderConfig.builder().name("openai").build();
        ModelCapability model = ModelCapability.builder().name("gpt-4o")
                .inputCostPer1k(0.25).outputCostPer1k(0.75).build();

        assertEquals(0.75, calculator.calculate(provider, model, 1500, 500), 1e-9);
    }

    @Test
    void fallsBackToProviderDefaultRates() {
        ProviderConfig provider = ProviderConfig.builder().name("openai")
                .defaultInputCostPer1k(0.01).defaultOutputCostPer1k(0.03).build();
        ModelCapability model = ModelCapability.builder().name("gpt-4o").outputCostPer1k(0.06).build();

        assertEquals(0.02 + 0.06, calculator.calculate(provider, model, 2000, 1000), 1e-9);
    }

    @Test
    void freeProviderCostsNothing() {
        ProviderConfig provider = ProviderConfig.builder().name("ollama").build();

        assertEquals(0.0, calculator.calculate(provider, null, 5000, 5000));
    }
}
