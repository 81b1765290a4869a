package in.quoteguard.application.service;

import in.quoteguard.application.port.output.ValidatorMetrics;
import in.quoteguard.domain.model.BalanceStatus;
import in.quoteguard.domain.model.EffectiveBalance;
import in.quoteguard.domain.model.MakerBalanceCacheEntry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class BalanceFreshnessClassifierTest {

    private static final String TOKEN = "0x00000000000000000000000000000000000000aa";
    private static final String MAKER = "0x000000000000000000000000000000000000000a";
    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");
    private static final Duration THRESHOLD = Duration.ofMinutes(2);

    @Mock
    private ValidatorMetrics metrics;

    private BalanceFreshnessClassifier classifier;

    @BeforeEach
    void setUp() {
        classifier = new BalanceFreshnessClassifier(THRESHOLD, metrics);
    }

    @Test
    void freshSampleUsesBalance() {
        MakerBalanceCacheEntry entry = MakerBalanceCacheEntry.sampled(
            TOKEN, MAKER, new BigDecimal("123.45"), NOW.minusSeconds(3600), NOW.minusSeconds(10));

        EffectiveBalance balance = classifier.classify(entry, NOW);

        assertEquals(BalanceStatus.FRESH, balance.status());
        assertFalse(balance.unconstrained());
        assertEquals(new BigDecimal("123.45"), balance.amount());
        verify(metrics).recordClassification(BalanceStatus.FRESH);
    }

    @Test
    void sampleExactlyAtThresholdIsStillFresh() {
        MakerBalanceCacheEntry entry = MakerBalanceCacheEntry.sampled(
            TOKEN, MAKER, BigDecimal.TEN, NOW.minusSeconds(3600), NOW.minus(THRESHOLD));

        assertEquals(BalanceStatus.FRESH, classifier.classify(entry, NOW).status());
    }

    @Test
    void sampleOlderThanThresholdIsDenied() {
        MakerBalanceCacheEntry entry = MakerBalanceCacheEntry.sampled(
            TOKEN, MAKER, BigDecimal.TEN, NOW.minusSeconds(3600), NOW.minus(THRESHOLD).minusMillis(1));

        EffectiveBalance balance = classifier.classify(entry, NOW);

        assertEquals(BalanceStatus.SAMPLE_STALE, balance.status());
        assertEquals(0, balance.amount().signum());
        verify(metrics).recordClassification(BalanceStatus.SAMPLE_STALE);
    }

    @Test
    void recentlyRegisteredIsUnconstrained() {
        MakerBalanceCacheEntry entry = MakerBalanceCacheEntry.registered(TOKEN, MAKER, NOW.minusSeconds(30));

        EffectiveBalance balance = classifier.classify(entry, NOW);

        assertEquals(BalanceStatus.RECENTLY_REGISTERED, balance.status());
        assertTrue(balance.unconstrained());
        assertTrue(balance.covers(new BigDecimal("1e40")));
    }

    @Test
    void registrationExactlyAtThresholdIsStillUnconstrained() {
        MakerBalanceCacheEntry entry = MakerBalanceCacheEntry.registered(TOKEN, MAKER, NOW.minus(THRESHOLD));

        assertTrue(classifier.classify(entry, NOW).unconstrained());
    }

    @Test
    void oldUnsampledRegistrationIsDenied() {
        MakerBalanceCacheEntry entry = MakerBalanceCacheEntry.registered(TOKEN, MAKER, NOW.minusSeconds(121));

        EffectiveBalance balance = classifier.classify(entry, NOW);

        assertEquals(BalanceStatus.UNSAMPLED_STUCK, balance.status());
        assertEquals(0, balance.amount().signum());
    }

    @Test
    void missingFirstSeenCountsAsEpoch() {
        MakerBalanceCacheEntry entry = new MakerBalanceCacheEntry(TOKEN, MAKER, null, null, null);

        assertEquals(BalanceStatus.UNSAMPLED_STUCK, classifier.classify(entry, NOW).status());
    }

    @Test
    void sampledRowWithNullBalanceIsDenied() {
        MakerBalanceCacheEntry entry = new MakerBalanceCacheEntry(TOKEN, MAKER, null, NOW.minusSeconds(300), NOW.minusSeconds(1));

        EffectiveBalance balance = classifier.classify(entry, NOW);

        assertEquals(BalanceStatus.INVALID_BALANCE, balance.status());
        assertEquals(0, balance.amount().signum());
    }

    @Test
    void negativeBalanceIsDenied() {
        MakerBalanceCacheEntry entry = MakerBalanceCacheEntry.sampled(
            TOKEN, MAKER, new BigDecimal("-5"), NOW.minusSeconds(300), NOW.minusSeconds(1));

        assertEquals(BalanceStatus.INVALID_BALANCE, classifier.classify(entry, NOW).status());
    }

    @Test
    void staleTakesPrecedenceOverNullBalance() {
        MakerBalanceCacheEntry entry = new MakerBalanceCacheEntry(TOKEN, MAKER, null, NOW.minusSeconds(900), NOW.minusSeconds(600));

        assertEquals(BalanceStatus.SAMPLE_STALE, classifier.classify(entry, NOW).status());
    }

    @Test
    void classifyAllKeysByMaker() {
        String otherMaker = "0x000000000000000000000000000000000000000b";
        Map<String, EffectiveBalance> lookup = classifier.classifyAll(List.of(
            MakerBalanceCacheEntry.sampled(TOKEN, MAKER, BigDecimal.ONE, NOW.minusSeconds(300), NOW.minusSeconds(1)),
            MakerBalanceCacheEntry.registered(TOKEN, otherMaker, NOW.minusSeconds(1))
        ), NOW);

        assertEquals(2, lookup.size());
        assertEquals(BalanceStatus.FRESH, lookup.get(MAKER).status());
        assertEquals(BalanceStatus.RECENTLY_REGISTERED, lookup.get(otherMaker).status());
    }

    @Test
    void rejectsNonPositiveThreshold() {
        assertThrows(IllegalArgumentException.class, () -> new BalanceFreshnessClassifier(Duration.ZERO, metrics));
        assertThrows(IllegalArgumentException.class, () -> new BalanceFreshnessClassifier(Duration.ofSeconds(-1), metrics));
        assertThrows(IllegalArgumentException.class, () -> new BalanceFreshnessClassifier(null, metrics));
    }
}
