package com.smartsched.timetable_engine.solver.refine;

import java.util.LinkedHashMap;
import java.util.Map;

import com.smartsched.timetable_engine.config.EngineSettings;

/**
 * Named re-weightings of the refinement cost, one per schedule variant. Factors scale the
 * configured weights, so deployment overrides carry into every profile. {@link #BALANCED} leaves
 * the configuration untouched.
 */
public enum WeightProfile {

    BALANCED("Balanced", 1.0, 1.0, 1.0, 1.0),
    DEPARTMENT_PREFERENCE("Department preferences first", 1.0, 0.5, 10.0, 1.0),
    ROOM_FIT("Tight room fit", 1.0, 4.0, 0.5, 1.0),
    CONFLICT_FIRST("Fewest conflicts", 5.0, 0.2, 0.2, 1.0),
    EXPLORATORY("Wide exploration", 1.0, 1.0, 1.0, 2.5);

    private final String displayName;
    private final double conflictFactor;
    private final double capacityFactor;
    private final double preferenceFactor;
    private final double mutationFactor;

    WeightProfile(String displayName, double conflictFactor, double capacityFactor, double preferenceFactor,
                  double mutationFactor) {
        this.displayName = displayName;
        this.conflictFactor = conflictFactor;
        this.capacityFactor = capacityFactor;
        this.preferenceFactor = preferenceFactor;
        this.mutationFactor = mutationFactor;
    }

    public String getDisplayName() {
        return displayName;
    }

    /** Settings for this profile's refinement run; each profile also gets its own seed. */
    public EngineSettings applyTo(EngineSettings base) {
        return base.toBuilder()
                .conflictWeight(base.getConflictWeight() * conflictFactor)
                .capacityWeight(base.getCapacityWeight() * capacityFactor)
                .preferenceWeight(base.getPreferenceWeight() * preferenceFactor)
                .mutationRate(Math.min(1.0, base.getMutationRate() * mutationFactor))
                .seed(base.getSeed() + ordinal())
                .build();
    }

    public Map<String, Double> weights(EngineSettings base) {
        EngineSettings applied = applyTo(base);
        Map<String, Double> weights = new LinkedHashMap<>();
        weights.put("conflict", applied.getConflictWeight());
        weights.put("capacity", applied.getCapacityWeight());
        weights.put("preference", applied.getPreferenceWeight());
        weights.put("mutationRate", applied.getMutationRate());
        return weights;
    }

    /** The first {@code count} profiles, in declaration order. */
    public static WeightProfile[] first(int count) {
        if (count < 1 || count > values().length) {
            throw new IllegalArgumentException("Variant count must be between 1 and " + values().length
                    + ", got " + count);
        }
        WeightProfile[] selected = new WeightProfile[count];
        System.arraycopy(values(), 0, selected, 0, count);
        return selected;
    }
}
