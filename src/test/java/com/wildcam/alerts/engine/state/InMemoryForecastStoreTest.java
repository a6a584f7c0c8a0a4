package com.wildcam.alerts.engine.state;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryForecastStoreTest {

    private final InMemoryForecastStore store = new InMemoryForecastStore();

    @Test
    void append_overCapacity_keepsMostRecentInOrder() {
        for (int i = 1; i <= 5; i++) {
            store.append("badger", 22, i * 1_000L, i, 3);
        }

        assertThat(store.samples("badger", 22)).containsExactly(3.0, 4.0, 5.0);
    }

    @Test
    void append_olderThanLatest_rejectedAcrossHours() {
        assertThat(store.append("badger", 22, 5_000L, 2, 100)).isTrue();

        assertThat(store.append("badger", 3, 4_000L, 7, 100)).isFalse();
        assertThat(store.samples("badger", 3)).isEmpty();
        assertThat(store.append("badger", 3, 5_000L, 7, 100)).isTrue();
    }

    @Test
    void samples_unknownSpeciesOrHour_empty() {
        store.append("badger", 22, 1_000L, 2, 100);

        assertThat(store.samples("otter", 22)).isEmpty();
        assertThat(store.samples("badger", 21)).isEmpty();
        assertThat(store.species()).containsExactly("badger");
    }
}
