package com.smartsched.timetable_engine.repository;

import java.util.Optional;

import org.springframework.data.mongodb.repository.MongoRepository;

import com.smartsched.timetable_engine.model.LearnedValueTable;

public interface ValueTableRepository extends MongoRepository<LearnedValueTable, String> {

    Optional<LearnedValueTable> findFirstByOrganizationIdAndSemester(String organizationId, String semester);
}
