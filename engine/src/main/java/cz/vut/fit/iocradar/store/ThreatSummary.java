package cz.vut.fit.iocradar.store;

import cz.vut.fit.iocradar.models.Classification;
import cz.vut.fit.iocradar.models.Indicator;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * An overview of the stored indicators.
 *
 * @param byClassification The number of records per classification.
 * @param recent24h        The number of records first seen in the last 24 hours.
 * @param topThreats       The highest scoring high or critical records.
 * @param total            The total number of records.
 */
public record ThreatSummary(Map<Classification, Long> byClassification, long recent24h,
                            List<Indicator> topThreats, long total) {
    public ThreatSummary {
        var copy = new EnumMap<Classification, Long>(Classification.class);
        for (var classification : Classification.values()) {
            copy.put(classification, 0L);
        }
        copy.putAll(byClassification);
        byClassification = Map.copyOf(copy);
        topThreats = List.copyOf(topThreats);
    }

    public static ThreatSummary empty() {
        return new ThreatSummary(Map.of(), 0, List.of(), 0);
    }
}
