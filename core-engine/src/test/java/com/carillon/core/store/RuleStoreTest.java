package com.carillon.core.store;

import com.carillon.core.model.ChimeRule;
import com.carillon.core.model.SoundRef;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link RuleStore}.
 */
class RuleStoreTest {

    private RuleStore store;

    @BeforeEach
    void setUp() {
        store = new RuleStore();
    }

    @Test
    @DisplayName("Should append when the position is past the end")
    void shouldAppendPastEnd() {
        store.upsertAt(1, rule(0));
        store.upsertAt(7, rule(15));

        assertThat(store.size()).isEqualTo(2);
        assertThat(store.snapshot()).containsExactly(rule(0), rule(15));
    }

    @Test
    @DisplayName("Should replace the rule at an existing position")
    void shouldReplaceExisting() {
        store.upsertAt(1, rule(0));
        store.upsertAt(2, rule(15));
        store.upsertAt(3, rule(30));

        store.upsertAt(2, rule(45));

        assertThat(store.snapshot()).containsExactly(rule(0), rule(45), rule(30));
    }

    @Test
    @DisplayName("Should place an upserted rule at index position-1 when position <= size+1")
    void shouldPlaceAtPosition() {
        store.upsertAt(1, rule(0));
        store.upsertAt(2, rule(15));

        store.upsertAt(3, rule(30));

        assertThat(store.snapshot().get(2)).isEqualTo(rule(30));
    }

    @Test
    @DisplayName("Should reject a non-positive position")
    void shouldRejectNonPositivePosition() {
        assertThatThrownBy(() -> store.upsertAt(0, rule(0)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should delete and shift later rules up")
    void shouldDeleteAndShift() throws RuleNotFoundException {
        store.upsertAt(1, rule(0));
        store.upsertAt(2, rule(15));
        store.upsertAt(3, rule(30));

        ChimeRule removed = store.deleteAt(2);

        assertThat(removed).isEqualTo(rule(15));
        assertThat(store.size()).isEqualTo(2);
        assertThat(store.snapshot()).containsExactly(rule(0), rule(30));
    }

    @Test
    @DisplayName("Should fail with RuleNotFoundException on an empty store")
    void shouldFailDeleteOnEmptyStore() {
        assertThatThrownBy(() -> store.deleteAt(1))
                .isInstanceOf(RuleNotFoundException.class)
                .hasMessageContaining("empty");
        assertThat(store.size()).isZero();
    }

    @Test
    @DisplayName("Should fail with RuleNotFoundException past the end and leave the store unchanged")
    void shouldFailDeleteOutOfRange() {
        store.upsertAt(1, rule(0));

        assertThatThrownBy(() -> store.deleteAt(2))
                .isInstanceOf(RuleNotFoundException.class)
                .satisfies(e -> {
                    RuleNotFoundException ex = (RuleNotFoundException) e;
                    assertThat(ex.position()).isEqualTo(2);
                    assertThat(ex.size()).isEqualTo(1);
                });
        assertThat(store.snapshot()).containsExactly(rule(0));
    }

    @Test
    @DisplayName("Should return snapshots unaffected by later mutations")
    void shouldIsolateSnapshots() throws RuleNotFoundException {
        store.upsertAt(1, rule(0));
        store.upsertAt(2, rule(15));
        List<ChimeRule> snapshot = store.snapshot();

        store.deleteAt(1);
        store.upsertAt(5, rule(45));

        assertThat(snapshot).containsExactly(rule(0), rule(15));
        assertThatThrownBy(() -> snapshot.add(rule(30)))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("Should remove a faulted rule at its last known position")
    void shouldRemoveFaultedAtPosition() {
        ChimeRule bad = rule(15);
        store.upsertAt(1, rule(0));
        store.upsertAt(2, bad);

        assertThat(store.removeFaulted(2, bad)).isTrue();
        assertThat(store.snapshot()).containsExactly(rule(0));
    }

    @Test
    @DisplayName("Should follow a faulted rule that moved before removing it")
    void shouldRemoveFaultedAfterShift() throws RuleNotFoundException {
        ChimeRule bad = rule(30);
        store.upsertAt(1, rule(0));
        store.upsertAt(2, rule(15));
        store.upsertAt(3, bad);
        store.deleteAt(1);

        assertThat(store.removeFaulted(3, bad)).isTrue();
        assertThat(store.snapshot()).containsExactly(rule(15));
    }

    @Test
    @DisplayName("Should leave an equal but separately entered rule alone")
    void shouldNotRemoveEqualReplacement() {
        ChimeRule bad = rule(15);
        store.upsertAt(1, bad);
        ChimeRule retyped = rule(15);
        store.upsertAt(1, retyped);

        assertThat(store.removeFaulted(1, bad)).isFalse();
        assertThat(store.snapshot()).hasSize(1);
        assertThat(store.snapshot().get(0)).isSameAs(retyped);
    }

    @Test
    @DisplayName("Should never expose a partially applied mutation to concurrent readers")
    void shouldStayConsistentUnderConcurrentEdits() throws Exception {
        int rounds = 5_000;
        CountDownLatch start = new CountDownLatch(1);
        AtomicReference<Throwable> failure = new AtomicReference<>();

        // Every state the writer commits holds at least one rule and all of
        // its rules share one minute.
        Thread writer = new Thread(() -> {
            try {
                start.await();
                for (int i = 0; i < rounds; i++) {
                    int size = 1 + i % 5;
                    store.replaceAll(sameMinute(i % 60, size));
                    store.upsertAt(size + 1, rule(i % 60));
                    store.deleteAt(1);
                }
            } catch (Throwable t) {
                failure.compareAndSet(null, t);
            }
        }, "test-writer");

        Thread reader = new Thread(() -> {
            try {
                start.await();
                for (int i = 0; i < rounds; i++) {
                    List<ChimeRule> snapshot = store.snapshot();
                    long distinctMinutes = snapshot.stream().mapToInt(ChimeRule::getMinute).distinct().count();
                    if (snapshot.isEmpty() || distinctMinutes != 1) {
                        throw new AssertionError("Torn snapshot: " + snapshot);
                    }
                    for (ChimeRule r : snapshot) {
                        if (r.getStartHour() != 0 || r.getEndHour() != 23) {
                            throw new AssertionError("Torn rule: " + r);
                        }
                    }
                }
            } catch (Throwable t) {
                failure.compareAndSet(null, t);
            }
        }, "test-reader");

        store.replaceAll(sameMinute(0, 1));
        writer.start();
        reader.start();
        start.countDown();
        writer.join(TimeUnit.SECONDS.toMillis(30));
        reader.join(TimeUnit.SECONDS.toMillis(30));

        assertThat(failure.get()).isNull();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static ChimeRule rule(int minute) {
        return ChimeRule.builder()
                .weekdays(0, 6)
                .hours(0, 23)
                .minute(minute)
                .sound(SoundRef.named("Chime" + minute))
                .build();
    }

    private static List<ChimeRule> sameMinute(int minute, int count) {
        List<ChimeRule> rules = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            rules.add(rule(minute));
        }
        return rules;
    }
}
