package it.aw.tieredmemory.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Contatori per tipo di query. averageSavingRate è la media semplice dei
 * saving rate delle query di quel tipo.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TypeStats(long count, double savingRateSum) {

    public static TypeStats empty() {
        return new TypeStats(0, 0.0);
    }

    public TypeStats plus(double savingRate) {
        return new TypeStats(count + 1, savingRateSum + savingRate);
    }

    @JsonProperty("averageSavingRate")
    public double averageSavingRate() {
        return count > 0 ? savingRateSum / count : 0.0;
    }
}
