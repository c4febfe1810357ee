package cz.vut.fit.iocradar.store;

import cz.vut.fit.iocradar.MutableClock;
import cz.vut.fit.iocradar.StorageUnavailableException;
import cz.vut.fit.iocradar.models.Classification;
import cz.vut.fit.iocradar.models.IndicatorKey;
import cz.vut.fit.iocradar.models.IndicatorKind;
import cz.vut.fit.iocradar.models.IndicatorUpdate;
import cz.vut.fit.iocradar.models.SourceObservation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class IndicatorStoreTest {

    private static final Instant START = Instant.parse("2024-05-01T12:00:00Z");
    private static final IndicatorKey KEY = new IndicatorKey("203.0.113.5", IndicatorKind.IP);

    private MutableClock clock;
    private InMemoryIndicatorBackend backend;
    private IndicatorStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        backend = new InMemoryIndicatorBackend();
        store = new IndicatorStore(backend, clock);
    }

    private IndicatorUpdate update(IndicatorKey key, int score, String source) {
        return update(key, score, source, Set.of(), null);
    }

    private IndicatorUpdate update(IndicatorKey key, int score, String source, Set<String> tags,
                                   String description) {
        var observation = new SourceObservation(source, score, Classification.classify(score), clock.instant(),
                Map.of());
        return new IndicatorUpdate(key, score, Set.of(source), List.of(observation), tags, description);
    }

    static Stream<Arguments> arrivalOrders() {
        return Stream.of(
                Arguments.of(List.of(10, 90, 40), "rising then falling"),
                Arguments.of(List.of(90, 40, 10), "descending"),
                Arguments.of(List.of(10, 40, 90), "ascending"),
                Arguments.of(List.of(40, 10, 90), "mixed")
        );
    }

    @ParameterizedTest(name = "{1}")
    @MethodSource("arrivalOrders")
    void upsert_scoreIsMaximumRegardlessOfOrder(List<Integer> scores, String description) throws Exception {
        int expectedSoFar = 0;
        for (int i = 0; i < scores.size(); i++) {
            clock.advance(Duration.ofMinutes(1));
            var outcome = store.upsert(update(KEY, scores.get(i), "source-" + i));
            expectedSoFar = Math.max(expectedSoFar, scores.get(i));

            assertEquals(expectedSoFar, outcome.record().threatScore());
            assertEquals(Classification.classify(expectedSoFar), outcome.record().classification());
        }

        var record = store.get(KEY.value(), KEY.kind()).orElseThrow();
        assertEquals(90, record.threatScore());
        assertEquals(Classification.CRITICAL, record.classification());
        assertEquals(Set.of("source-0", "source-1", "source-2"), record.sources());
        assertEquals(3, record.sourceObservations().size());
    }

    @Test
    void upsert_sameKeyKeepsOneRecordAndUnionsSources() throws Exception {
        store.upsert(update(KEY, 20, "A"));
        store.upsert(update(KEY, 20, "B"));
        store.upsert(update(KEY, 20, "A"));

        assertEquals(1, backend.size());
        assertEquals(Set.of("A", "B"), store.get(KEY.value(), KEY.kind()).orElseThrow().sources());
    }

    @Test
    void upsert_sameValueDifferentKindIsDifferentRecord() throws Exception {
        var hash = "d41d8cd98f00b204e9800998ecf8427e";
        store.upsert(update(new IndicatorKey(hash, IndicatorKind.HASH), 50, "A"));
        store.upsert(update(new IndicatorKey(hash, IndicatorKind.DOMAIN), 50, "A"));

        assertEquals(2, backend.size());
    }

    @Test
    void upsert_keepsFirstSeenAndAdvancesLastSeen() throws Exception {
        var created = store.upsert(update(KEY, 30, "A"));
        clock.advance(Duration.ofHours(2));
        var merged = store.upsert(update(KEY, 10, "B"));

        assertEquals(START, created.record().firstSeen());
        assertEquals(START, merged.record().firstSeen());
        assertEquals(START.plus(Duration.ofHours(2)), merged.record().lastSeen());
    }

    @Test
    void upsert_reportsMaterialChanges() throws Exception {
        var created = store.upsert(update(KEY, 30, "A"));
        assertTrue(created.created());
        assertTrue(created.changed());

        var lower = store.upsert(update(KEY, 20, "B"));
        assertFalse(lower.created());
        assertFalse(lower.changed());

        var higher = store.upsert(update(KEY, 35, "C"));
        assertTrue(higher.changed());
        assertEquals(Classification.MEDIUM, higher.record().classification());
    }

    @Test
    void upsert_descriptionReplacedOnlyWhenSupplied() throws Exception {
        store.upsert(update(KEY, 30, "A", Set.of(), "first"));
        store.upsert(update(KEY, 30, "B", Set.of(), null));
        assertEquals("first", store.get(KEY.value(), KEY.kind()).orElseThrow().description());

        store.upsert(update(KEY, 30, "C", Set.of(), "second"));
        assertEquals("second", store.get(KEY.value(), KEY.kind()).orElseThrow().description());
    }

    @Test
    void queryPage_thirdPageOfHundredTwenty() throws Exception {
        for (int i = 0; i < 120; i++) {
            clock.advance(Duration.ofSeconds(1));
            store.upsert(update(new IndicatorKey("192.0.2." + i, IndicatorKind.IP), 50, "A"));
        }

        var page = store.queryPage(IndicatorQuery.all(), SortOrder.FIRST_SEEN_DESC, 3, 50);
        assertEquals(20, page.items().size());
        assertEquals(120, page.total());
        assertEquals(3, page.pages());
        // Oldest records are on the last page
        assertEquals("192.0.2.0", page.items().get(19).value());

        var first = store.queryPage(IndicatorQuery.all(), SortOrder.FIRST_SEEN_DESC, 1, 50);
        assertEquals("192.0.2.119", first.items().get(0).value());

        var pastEnd = store.queryPage(IndicatorQuery.all(), SortOrder.FIRST_SEEN_DESC, 4, 50);
        assertTrue(pastEnd.items().isEmpty());
        assertEquals(120, pastEnd.total());
    }

    @Test
    void queryPage_rejectsInvalidPaging() {
        assertThrows(IllegalArgumentException.class,
                () -> store.queryPage(IndicatorQuery.all(), SortOrder.FIRST_SEEN_DESC, 0, 50));
        assertThrows(IllegalArgumentException.class,
                () -> store.queryPage(IndicatorQuery.all(), SortOrder.FIRST_SEEN_DESC, 1, 0));
    }

    @Test
    void queryPage_filtersBySearchAndTag() throws Exception {
        store.upsert(update(new IndicatorKey("evil.example", IndicatorKind.DOMAIN), 70, "A",
                Set.of("phishing"), "Credential harvesting page"));
        store.upsert(update(new IndicatorKey("good.example", IndicatorKind.DOMAIN), 5, "A",
                Set.of("benign"), null));
        store.upsert(update(new IndicatorKey("198.51.100.1", IndicatorKind.IP), 90, "A",
                Set.of("phishing"), "Hosts EVIL kits"));

        var bySearch = store.queryPage(IndicatorQuery.all().withSearch("evil"), SortOrder.THREAT_SCORE_DESC, 1, 10);
        assertEquals(List.of("198.51.100.1", "evil.example"),
                bySearch.items().stream().map(i -> i.value()).toList());

        var byTag = store.queryPage(IndicatorQuery.all().withTag("phishing").withKind(IndicatorKind.DOMAIN),
                SortOrder.THREAT_SCORE_DESC, 1, 10);
        assertEquals(1, byTag.total());
        assertEquals("evil.example", byTag.items().get(0).value());

        var byTagPrefix = store.queryPage(IndicatorQuery.all().withTag("phish"), SortOrder.THREAT_SCORE_DESC, 1, 10);
        assertEquals(0, byTagPrefix.total());
    }

    @Test
    void statsSince_countsByFirstSeen() throws Exception {
        store.upsert(update(new IndicatorKey("192.0.2.1", IndicatorKind.IP), 90, "A"));
        clock.advance(Duration.ofHours(2));
        store.upsert(update(new IndicatorKey("192.0.2.2", IndicatorKind.IP), 90, "A"));
        store.upsert(update(new IndicatorKey("192.0.2.3", IndicatorKind.IP), 40, "A"));
        // A merge does not move the record into the window
        store.upsert(update(new IndicatorKey("192.0.2.1", IndicatorKind.IP), 90, "B"));

        var cutoff = clock.instant().minus(Duration.ofHours(1));
        assertEquals(2, store.statsSince(cutoff, null));
        assertEquals(1, store.statsSince(cutoff, Classification.CRITICAL));
        assertEquals(0, store.statsSince(cutoff, Classification.HIGH));
    }

    @Test
    void addTags_unionsAndNeverCreates() throws Exception {
        assertTrue(store.addTags(KEY.value(), KEY.kind(), Set.of("watchlist")).isEmpty());
        assertEquals(0, backend.size());

        store.upsert(update(KEY, 30, "A", Set.of("scanner"), null));
        var tagged = store.addTags(KEY.value(), KEY.kind(), Set.of("watchlist", " ")).orElseThrow();

        assertEquals(Set.of("scanner", "watchlist"), tagged.tags());
        assertEquals(30, tagged.threatScore());
    }

    @Test
    void timeline_returnsNewestFirst() throws Exception {
        store.upsert(update(KEY, 10, "A"));
        clock.advance(Duration.ofMinutes(5));
        store.upsert(update(KEY, 20, "B"));

        var timeline = store.timeline(KEY.value(), KEY.kind()).orElseThrow();
        assertEquals(List.of("B", "A"), timeline.stream().map(SourceObservation::source).toList());
        assertTrue(store.timeline("192.0.2.200", IndicatorKind.IP).isEmpty());
    }

    @Test
    void trends_groupsByDayAndClassification() throws Exception {
        store.upsert(update(new IndicatorKey("192.0.2.1", IndicatorKind.IP), 90, "A"));
        store.upsert(update(new IndicatorKey("192.0.2.2", IndicatorKind.IP), 85, "A"));
        clock.advance(Duration.ofDays(1));
        store.upsert(update(new IndicatorKey("192.0.2.3", IndicatorKind.IP), 40, "A"));

        var trends = store.trends(7);
        assertEquals(List.of(
                new TrendPoint(LocalDate.of(2024, 5, 1), Classification.CRITICAL, 2),
                new TrendPoint(LocalDate.of(2024, 5, 2), Classification.MEDIUM, 1)
        ), trends);

        clock.advance(Duration.ofDays(10));
        assertTrue(store.trends(7).isEmpty());
        assertThrows(IllegalArgumentException.class, () -> store.trends(0));
    }

    @Test
    void threatSummary_countsAndTopThreats() throws Exception {
        store.upsert(update(new IndicatorKey("192.0.2.1", IndicatorKind.IP), 95, "A"));
        store.upsert(update(new IndicatorKey("192.0.2.2", IndicatorKind.IP), 65, "A"));
        store.upsert(update(new IndicatorKey("192.0.2.3", IndicatorKind.IP), 85, "A"));
        store.upsert(update(new IndicatorKey("192.0.2.4", IndicatorKind.IP), 10, "A"));

        var summary = store.threatSummary(2);
        assertEquals(4, summary.total());
        assertEquals(4, summary.recent24h());
        assertEquals(2L, summary.byClassification().get(Classification.CRITICAL));
        assertEquals(0L, summary.byClassification().get(Classification.MEDIUM));
        assertEquals(List.of("192.0.2.1", "192.0.2.3"),
                summary.topThreats().stream().map(i -> i.value()).toList());
    }

    @Test
    void threatSummary_degradesToEmptyOnBackendFailure() throws Exception {
        var failing = mock(IndicatorBackend.class);
        when(failing.aggregate(any())).thenThrow(new StorageUnavailableException("down"));

        assertEquals(ThreatSummary.empty(), new IndicatorStore(failing, clock).threatSummary(10));
    }

    @Test
    void rollingStats_derivesThreatLevel() throws Exception {
        for (int i = 0; i < 6; i++) {
            store.upsert(update(new IndicatorKey("192.0.2." + i, IndicatorKind.IP), 90, "A"));
        }
        store.upsert(update(new IndicatorKey("192.0.2.100", IndicatorKind.IP), 70, "A"));

        var stats = store.rollingStats();
        assertEquals(7, stats.threatsLastHour());
        assertEquals(7, stats.threatsLast24h());
        assertEquals(7, stats.totalIndicators());
        assertEquals(6, stats.lastHour(Classification.CRITICAL));
        assertEquals(cz.vut.fit.iocradar.models.ThreatLevel.CRITICAL, stats.threatLevel());

        clock.advance(Duration.ofHours(2));
        var later = store.rollingStats();
        assertEquals(0, later.threatsLastHour());
        assertEquals(7, later.threatsLast24h());
        assertEquals(cz.vut.fit.iocradar.models.ThreatLevel.LOW, later.threatLevel());
    }
}
