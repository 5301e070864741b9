package com.smartsched.timetable_engine.model;

import java.util.List;

public record Cluster(int id, List<String> courseIds) {

    public Cluster {
        courseIds = List.copyOf(courseIds);
    }

    public int size() {
        return courseIds.size();
    }
}
