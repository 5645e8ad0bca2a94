package com.llmrelay.relay_backend.service;

import com.llmrelay.relay_backend.config.RelayProperties;
import com.llmrelay.relay_backend.model.usage.CostRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Prices a call from a fixed per-1K-token rate table. Short names are resolved through the
 * alias table first; models missing from the table cost 0.0.
 *
 * <p>Tables are frozen at construction, so concurrent callers need no locking.
 */
@Slf4j
@Service
public class CostEstimator {

    /** USD per 1K tokens: {prompt, completion}. */
    private static final Map<String, double[]> DEFAULT_RATES = new LinkedHashMap<>();
    private static final Map<String, String> DEFAULT_ALIASES = new LinkedHashMap<>();

    static {
        DEFAULT_RATES.put("gpt-4",         new double[]{0.03, 0.06});
        DEFAULT_RATES.put("gpt-4-turbo",   new double[]{0.01, 0.03});
        DEFAULT_RATES.put("gpt-4o",        new double[]{0.005, 0.015});
        DEFAULT_RATES.put("gpt-4o-mini",   new double[]{0.00015, 0.0006});
        DEFAULT_RATES.put("gpt-3.5-turbo", new double[]{0.0015, 0.002});
        // Bedrock prices vary by region; these are approximate
        DEFAULT_RATES.put("anthropic.claude-3-5-sonnet-20241022-v2:0", new double[]{0.003, 0.015});
        DEFAULT_RATES.put("anthropic.claude-3-5-sonnet-20240620-v1:0", new double[]{0.003, 0.015});
        DEFAULT_RATES.put("anthropic.claude-3-5-haiku-20241022-v1:0",  new double[]{0.0008, 0.004});
        DEFAULT_RATES.put("anthropic.claude-3-sonnet-20240229-v1:0",   new double[]{0.003, 0.015});
        DEFAULT_RATES.put("anthropic.claude-3-haiku-20240307-v1:0",    new double[]{0.00025, 0.00125});
        DEFAULT_RATES.put("anthropic.claude-3-opus-20240229-v1:0",     new double[]{0.015, 0.075});

        DEFAULT_ALIASES.put("claude-3-sonnet",      "anthropic.claude-3-sonnet-20240229-v1:0");
        DEFAULT_ALIASES.put("claude-3-haiku",       "anthropic.claude-3-haiku-20240307-v1:0");
        DEFAULT_ALIASES.put("claude-3-opus",        "anthropic.claude-3-opus-20240229-v1:0");
        DEFAULT_ALIASES.put("claude-3.5-sonnet",    "anthropic.claude-3-5-sonnet-20240620-v1:0");
        DEFAULT_ALIASES.put("claude-3.5-sonnet-v2", "anthropic.claude-3-5-sonnet-20241022-v2:0");
        DEFAULT_ALIASES.put("claude-3.5-haiku",     "anthropic.claude-3-5-haiku-20241022-v1:0");
    }

    private final Map<String, double[]> rates;
    private final Map<String, String> aliases;

    public CostEstimator() {
        this(Map.of(), Map.of());
    }

    @Autowired
    public CostEstimator(RelayProperties props) {
        this(props.getPricing().getRates(), props.getPricing().getAliases());
    }

    public CostEstimator(Map<String, RelayProperties.Rate> extraRates, Map<String, String> extraAliases) {
        Map<String, double[]> r = new LinkedHashMap<>(DEFAULT_RATES);
        if (extraRates != null) {
            extraRates.forEach((model, rate) -> r.put(model, new double[]{rate.getPrompt(), rate.getCompletion()}));
        }
        Map<String, String> a = new LinkedHashMap<>(DEFAULT_ALIASES);
        if (extraAliases != null) a.putAll(extraAliases);
        this.rates = Map.copyOf(r);
        this.aliases = Map.copyOf(a);
    }

    public double estimate(String model, int promptTokens, int completionTokens) {
        if (model == null) return 0.0;
        String resolved = aliases.getOrDefault(model, model);
        double[] rate = rates.get(resolved);
        if (rate == null) {
            log.debug("No rate for model '{}' (resolved '{}'); cost defaults to 0.0", model, resolved);
            return 0.0;
        }
        double raw = (promptTokens / 1000.0) * rate[0] + (completionTokens / 1000.0) * rate[1];
        return BigDecimal.valueOf(raw).setScale(6, RoundingMode.HALF_EVEN).doubleValue();
    }

    public CostRecord record(String model, int promptTokens, int completionTokens) {
        return new CostRecord(model, promptTokens, completionTokens, estimate(model, promptTokens, completionTokens));
    }

    public boolean isPriced(String model) {
        return model != null && rates.containsKey(aliases.getOrDefault(model, model));
    }
}
