package com.edugen.ai.usage;

import java.util.Locale;
import java.util.Map;

/**
 * Static per-provider rate table. Prices are USD per one million units:
 * tokens for language models, characters for speech synthesis.
 */
public final class CostCalculator {
    
    private static final double PER_MILLION = 1_000_000.0;
    
    private static final Map<String, Rate> RATES = Map.of(
        "deepseek", new Rate(0.14, 0.28),
        "gemini", new Rate(0.075, 0.30),
        "azure", new Rate(16.0, 0.0),
        "edge", Rate.FREE
    );
    
    private CostCalculator() {}
    
    /**
     * Cost of one call. Unknown providers are priced at zero.
     */
    public static double cost(String provider, long inputUnits, long outputUnits) {
        Rate rate = rateFor(provider);
        double amount = (Math.max(0, inputUnits) * rate.inputPerMillion()
            + Math.max(0, outputUnits) * rate.outputPerMillion()) / PER_MILLION;
        return amount;
    }
    
    public static double synthesisCost(String provider, int characters) {
        return cost(provider, characters, 0);
    }
    
    public static boolean isFreeTier(String provider) {
        return rateFor(provider).equals(Rate.FREE);
    }
    
    private static Rate rateFor(String provider) {
        if (provider == null) {
            return Rate.FREE;
        }
        return RATES.getOrDefault(provider.toLowerCase(Locale.ROOT), Rate.FREE);
    }
    
    private record Rate(double inputPerMillion, double outputPerMillion) {
        static final Rate FREE = new Rate(0.0, 0.0);
    }
}
