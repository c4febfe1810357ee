package cz.vut.fit.iocradar.store;

import cz.vut.fit.iocradar.models.Indicator;

import java.util.List;

/**
 * One window of matching records together with the total number of matches.
 */
public record FindResult(List<Indicator> records, long totalMatching) {
    public FindResult {
        records = List.copyOf(records);
    }
}
