package com.smartsched.timetable_engine.solver.cpsat;

import java.util.List;

import com.google.ortools.sat.BoolVar;
import com.google.ortools.sat.CpModel;

/**
 * A built CP-SAT model together with the (session, slot, room) triple behind each variable.
 */
record ClusterModel(CpModel model,
                    List<BoolVar> variables,
                    int[] tripleSession,
                    int[] tripleSlot,
                    int[] tripleRoom,
                    int studentConstraints) {

    int domainSize() {
        return variables.size();
    }
}
