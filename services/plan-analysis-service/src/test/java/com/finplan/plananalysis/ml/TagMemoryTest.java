package com.finplan.plananalysis.ml;

import com.finplan.plananalysis.model.ItemTag;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("TagMemory Tests")
class TagMemoryTest {

    private final TagMemory memory = new TagMemory();

    @Test
    @DisplayName("Should normalize terms on learn and lookup")
    void shouldNormalizeTerms() {
        memory.learn("  Netflix ", ItemTag.RECURRING);

        assertThat(memory.lookup("NETFLIX")).contains(ItemTag.RECURRING);
        assertThat(memory.snapshot()).containsOnlyKeys("netflix");
    }

    @Test
    @DisplayName("Should be idempotent when the same correction is learned twice")
    void shouldBeIdempotent() {
        memory.learn("netflix", ItemTag.RECURRING);
        Map<String, ItemTag> once = memory.snapshot();

        memory.learn("netflix", ItemTag.RECURRING);

        assertThat(memory.snapshot()).isEqualTo(once);
        assertThat(memory.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should let the latest correction win")
    void shouldKeepLatest() {
        memory.learn("gym", ItemTag.RECURRING);
        memory.learn("gym", ItemTag.BUDGET);
        memory.learnBatch(List.of(
            new LearnedCorrection("uber", ItemTag.BUDGET),
            new LearnedCorrection("Uber", ItemTag.DEBT)));

        assertThat(memory.lookup("gym")).contains(ItemTag.BUDGET);
        assertThat(memory.lookup("uber")).contains(ItemTag.DEBT);
    }

    @Test
    @DisplayName("Should apply nothing when a batch contains an invalid correction")
    void shouldRejectInvalidBatchAtomically() {
        List<LearnedCorrection> batch = List.of(
            new LearnedCorrection("rent", ItemTag.RECURRING),
            new LearnedCorrection("  ", ItemTag.BUDGET));

        assertThatThrownBy(() -> memory.learnBatch(batch)).isInstanceOf(IllegalArgumentException.class);
        assertThat(memory.size()).isZero();
    }

    @Test
    @DisplayName("Should never expose a partially applied batch to concurrent readers")
    void shouldPublishBatchesAtomically() throws Exception {
        // Given
        int batchSize = 200;
        List<LearnedCorrection> batch = new ArrayList<>();
        for (int i = 0; i < batchSize; i++) {
            batch.add(new LearnedCorrection("term-" + i, ItemTag.DEBT));
        }
        ExecutorService executor = Executors.newFixedThreadPool(4);
        CountDownLatch start = new CountDownLatch(1);
        AtomicBoolean torn = new AtomicBoolean(false);
        AtomicBoolean done = new AtomicBoolean(false);

        try {
            List<Future<?>> readers = new ArrayList<>();
            for (int r = 0; r < 3; r++) {
                readers.add(executor.submit(() -> {
                    start.await();
                    while (!done.get()) {
                        int size = memory.snapshot().size();
                        if (size != 0 && size != batchSize) {
                            torn.set(true);
                        }
                    }
                    return null;
                }));
            }

            // When
            start.countDown();
            memory.learnBatch(batch);
            done.set(true);
            for (Future<?> reader : readers) {
                reader.get(10, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        // Then
        assertThat(torn).isFalse();
        assertThat(memory.size()).isEqualTo(batchSize);
    }
}
