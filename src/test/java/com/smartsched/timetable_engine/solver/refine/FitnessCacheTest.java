package com.smartsched.timetable_engine.solver.refine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Set;

import org.junit.jupiter.api.Test;

class FitnessCacheTest {

    private static final Fitness FIT = new Fitness(0, 0, 0, 0.0);

    @Test
    void neverGrowsBeyondItsCap() {
        FitnessCache cache = new FitnessCache(10, 1000);
        for (long signature = 0; signature < 100; signature++) {
            cache.put(signature, FIT);
        }

        assertThat(cache.size()).isEqualTo(10);
        assertThat(cache.peakSize()).isEqualTo(10);
        // least recently used entries went first
        assertThat(cache.get(0L)).isNull();
        assertThat(cache.get(99L)).isEqualTo(FIT);
    }

    @Test
    void periodicEvictionKeepsOnlyTheSurvivors() {
        FitnessCache cache = new FitnessCache(100, 3);
        for (long signature = 0; signature < 20; signature++) {
            cache.put(signature, FIT);
        }

        cache.endGeneration(Set.of(1L, 2L));
        cache.endGeneration(Set.of(1L, 2L));
        assertThat(cache.size()).isEqualTo(20);

        cache.endGeneration(Set.of(1L, 2L));

        assertThat(cache.size()).isEqualTo(2);
        assertThat(cache.get(1L)).isEqualTo(FIT);
    }

    @Test
    void countsHitsAndMisses() {
        FitnessCache cache = new FitnessCache(4, 2);
        cache.put(7L, FIT);

        cache.get(7L);
        cache.get(8L);

        assertThat(cache.hits()).isEqualTo(1);
        assertThat(cache.misses()).isEqualTo(1);
    }

    @Test
    void rejectsNonPositiveBounds() {
        assertThatThrownBy(() -> new FitnessCache(0, 5)).isInstanceOf(IllegalArgumentException.class);
    }
}
