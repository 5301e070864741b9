package com.smartsched.timetable_engine.solver.refine;

public record RefinementResult(Chromosome best,
                               Fitness bestFitness,
                               Fitness seedFitness,
                               int generationsRun,
                               int cachePeakSize) {

    public boolean improved() {
        return bestFitness.cost() < seedFitness.cost();
    }
}
