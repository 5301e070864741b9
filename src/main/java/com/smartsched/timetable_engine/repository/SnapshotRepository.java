package com.smartsched.timetable_engine.repository;

import java.util.Optional;

import org.springframework.data.mongodb.repository.MongoRepository;

import com.smartsched.timetable_engine.model.TimetableSnapshot;

public interface SnapshotRepository extends MongoRepository<TimetableSnapshot, String> {

    Optional<TimetableSnapshot> findFirstByOrganizationIdAndSemesterAndAcademicYear(String organizationId,
                                                                                    String semester,
                                                                                    String academicYear);
}
