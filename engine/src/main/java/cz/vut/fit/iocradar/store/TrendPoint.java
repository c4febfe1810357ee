package cz.vut.fit.iocradar.store;

import cz.vut.fit.iocradar.models.Classification;

import java.time.LocalDate;

/**
 * The number of records of one classification first seen on one UTC day.
 */
public record TrendPoint(LocalDate day, Classification classification, long count) {
}
