package fr.lapetina.vpn.selector.domain.selection;

import fr.lapetina.vpn.selector.domain.model.Protocol;
import fr.lapetina.vpn.selector.domain.model.ScoredCandidate;
import fr.lapetina.vpn.selector.domain.model.SelectionKey;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BestServerTableTest {

    private static final SelectionKey US_STANDARD_UDP =
            new SelectionKey("US", "Standard VPN servers", Protocol.UDP);
    private static final SelectionKey US_STANDARD_TCP =
            new SelectionKey("US", "Standard VPN servers", Protocol.TCP);

    private static ScoredCandidate candidate(String domain, String score, int position) {
        return new ScoredCandidate(domain + ".udp[Standard VPN servers]", domain, new BigDecimal(score), position);
    }

    @Nested
    @DisplayName("offer")
    class OfferTests {

        private BestServerTable table;

        @BeforeEach
        void setUp() {
            table = new BestServerTable();
            table.start();
        }

        @Test
        @DisplayName("should fill an empty key, even with a zero score")
        void shouldFillEmptyKey() {
            assertThat(table.offer(US_STANDARD_UDP, candidate("a", "0.0000", 0))).isTrue();

            assertThat(table.get(US_STANDARD_UDP)).map(ScoredCandidate::domain).contains("a");
        }

        @Test
        @DisplayName("should replace the holder only with a strictly higher score")
        void shouldReplaceOnlyWhenStrictlyHigher() {
            table.offer(US_STANDARD_UDP, candidate("a", "0.2500", 0));

            assertThat(table.offer(US_STANDARD_UDP, candidate("b", "0.2400", 1))).isFalse();
            assertThat(table.offer(US_STANDARD_UDP, candidate("c", "0.2500", 2))).isFalse();
            assertThat(table.get(US_STANDARD_UDP)).map(ScoredCandidate::domain).contains("a");

            assertThat(table.offer(US_STANDARD_UDP, candidate("d", "0.2501", 3))).isTrue();
            assertThat(table.get(US_STANDARD_UDP)).map(ScoredCandidate::domain).contains("d");
        }

        @Test
        @DisplayName("should break score ties by earlier list position, whatever the offer order")
        void shouldBreakTiesByPosition() {
            table.offer(US_STANDARD_UDP, candidate("late", "0.2940", 7));

            assertThat(table.offer(US_STANDARD_UDP, candidate("early", "0.2940", 2))).isTrue();
            assertThat(table.offer(US_STANDARD_UDP, candidate("later", "0.2940", 9))).isFalse();
            assertThat(table.get(US_STANDARD_UDP)).map(ScoredCandidate::domain).contains("early");
        }

        @Test
        @DisplayName("should keep keys independent")
        void shouldKeepKeysIndependent() {
            table.offer(US_STANDARD_UDP, candidate("a", "0.3000", 0));
            table.offer(US_STANDARD_TCP, candidate("b", "0.1000", 1));

            assertThat(table.size()).isEqualTo(2);
            assertThat(table.get(US_STANDARD_TCP)).map(ScoredCandidate::domain).contains("b");
        }

        @Test
        @DisplayName("should let a positive score displace a zero-score holder")
        void shouldDisplaceZeroScore() {
            table.offer(US_STANDARD_UDP, candidate("saturated", "0.0000", 0));
            table.offer(US_STANDARD_UDP, candidate("ok", "0.1000", 1));

            assertThat(table.get(US_STANDARD_UDP)).map(ScoredCandidate::domain).contains("ok");
        }
    }

    @Nested
    @DisplayName("lifecycle")
    class LifecycleTests {

        @Test
        @DisplayName("should move IDLE -> RUNNING -> DRAINED -> FINALIZED")
        void shouldFollowLifecycle() {
            BestServerTable table = new BestServerTable();
            assertThat(table.getState()).isEqualTo(TableState.IDLE);

            table.start();
            assertThat(table.getState()).isEqualTo(TableState.RUNNING);

            table.drain();
            assertThat(table.getState()).isEqualTo(TableState.DRAINED);

            Map<SelectionKey, ScoredCandidate> snapshot = table.snapshot();
            assertThat(table.getState()).isEqualTo(TableState.FINALIZED);
            assertThat(snapshot).isEmpty();
        }

        @Test
        @DisplayName("should reject offers outside RUNNING")
        void shouldRejectOffersOutsideRunning() {
            BestServerTable table = new BestServerTable();
            assertThatThrownBy(() -> table.offer(US_STANDARD_UDP, candidate("a", "0.1", 0)))
                    .isInstanceOf(IllegalStateException.class);

            table.start();
            table.drain();
            assertThatThrownBy(() -> table.offer(US_STANDARD_UDP, candidate("a", "0.1", 0)))
                    .isInstanceOf(IllegalStateException.class);
        }

        @Test
        @DisplayName("should not go back or snapshot twice")
        void shouldNotGoBack() {
            BestServerTable table = new BestServerTable();
            assertThatThrownBy(table::snapshot).isInstanceOf(IllegalStateException.class);

            table.start();
            table.drain();
            table.snapshot();

            assertThatThrownBy(table::start).isInstanceOf(IllegalStateException.class);
            assertThatThrownBy(table::snapshot).isInstanceOf(IllegalStateException.class);
        }

        @Test
        @DisplayName("should hand out a read-only snapshot")
        void shouldReturnReadOnlySnapshot() {
            BestServerTable table = new BestServerTable();
            table.start();
            table.offer(US_STANDARD_UDP, candidate("a", "0.1", 0));
            table.drain();

            Map<SelectionKey, ScoredCandidate> snapshot = table.snapshot();

            assertThatThrownBy(() -> snapshot.remove(US_STANDARD_UDP))
                    .isInstanceOf(UnsupportedOperationException.class);
        }
    }

    @Nested
    @DisplayName("order independence")
    class OrderIndependenceTests {

        private List<Map.Entry<SelectionKey, ScoredCandidate>> offers() {
            List<Map.Entry<SelectionKey, ScoredCandidate>> offers = new ArrayList<>();
            String[] countries = {"US", "DE", "FR"};
            for (int i = 0; i < 60; i++) {
                SelectionKey key = new SelectionKey(countries[i % 3], "P2P", i % 2 == 0 ? Protocol.UDP : Protocol.TCP);
                // scores repeat in runs of twelve, so every key sees equal-score offers
                String score = String.format(Locale.ROOT, "0.%04d", 1000 + (i / 12) * 37);
                offers.add(Map.entry(key, candidate("s" + i, score, i)));
            }
            return offers;
        }

        private Map<SelectionKey, ScoredCandidate> reduce(List<Map.Entry<SelectionKey, ScoredCandidate>> offers) {
            BestServerTable table = new BestServerTable();
            table.start();
            offers.forEach(e -> table.offer(e.getKey(), e.getValue()));
            table.drain();
            return table.snapshot();
        }

        @Test
        @DisplayName("should yield the same table for any offer order")
        void shouldBeOrderIndependent() {
            List<Map.Entry<SelectionKey, ScoredCandidate>> offers = offers();
            Map<SelectionKey, ScoredCandidate> expected = reduce(offers);

            Random random = new Random(42);
            for (int round = 0; round < 20; round++) {
                List<Map.Entry<SelectionKey, ScoredCandidate>> shuffled = new ArrayList<>(offers);
                Collections.shuffle(shuffled, random);
                assertThat(reduce(shuffled)).isEqualTo(expected);
            }
        }

        @Test
        @DisplayName("should keep the earliest position among equal scores for any offer order")
        void shouldResolveTiesRegardlessOfOrder() {
            List<Map.Entry<SelectionKey, ScoredCandidate>> offers = new ArrayList<>();
            for (int i = 0; i < 12; i++) {
                offers.add(Map.entry(US_STANDARD_UDP, candidate("t" + i, "0.2940", i)));
            }

            Random random = new Random(7);
            for (int round = 0; round < 20; round++) {
                List<Map.Entry<SelectionKey, ScoredCandidate>> shuffled = new ArrayList<>(offers);
                Collections.shuffle(shuffled, random);
                assertThat(reduce(shuffled).get(US_STANDARD_UDP).domain()).isEqualTo("t0");
            }
        }

        @Test
        @DisplayName("should lose no update under concurrent offers")
        void shouldBeThreadSafe() throws InterruptedException {
            List<Map.Entry<SelectionKey, ScoredCandidate>> offers = offers();
            Map<SelectionKey, ScoredCandidate> expected = reduce(offers);

            BestServerTable table = new BestServerTable();
            table.start();

            int threads = 8;
            ExecutorService executor = Executors.newFixedThreadPool(threads);
            CountDownLatch latch = new CountDownLatch(threads);
            for (int t = 0; t < threads; t++) {
                List<Map.Entry<SelectionKey, ScoredCandidate>> shuffled = new ArrayList<>(offers);
                Collections.shuffle(shuffled, new Random(t));
                executor.submit(() -> {
                    try {
                        shuffled.forEach(e -> table.offer(e.getKey(), e.getValue()));
                    } finally {
                        latch.countDown();
                    }
                });
            }

            assertThat(latch.await(10, TimeUnit.SECONDS)).isTrue();
            executor.shutdown();

            table.drain();
            assertThat(table.snapshot()).isEqualTo(expected);
        }
    }
}
