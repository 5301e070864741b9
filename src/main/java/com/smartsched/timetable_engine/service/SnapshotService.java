package com.smartsched.timetable_engine.service;

import java.util.NoSuchElementException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.smartsched.timetable_engine.dto.CatalogPayload;
import com.smartsched.timetable_engine.model.TimetableSnapshot;
import com.smartsched.timetable_engine.repository.SnapshotRepository;

import lombok.RequiredArgsConstructor;

@Service
@RequiredArgsConstructor
public class SnapshotService {

    private static final Logger logger = LoggerFactory.getLogger(SnapshotService.class);

    private final SnapshotRepository snapshotRepository;

    public CatalogPayload load(String organizationId, String semester, String academicYear) {
        if (organizationId == null || semester == null || academicYear == null) {
            throw new IllegalArgumentException("Organization, semester and academic year are required.");
        }
        TimetableSnapshot snapshot = snapshotRepository
                .findFirstByOrganizationIdAndSemesterAndAcademicYear(organizationId, semester, academicYear)
                .orElseThrow(() -> new NoSuchElementException(
                        "No snapshot for " + organizationId + " " + semester + " " + academicYear));
        logger.info("Loaded snapshot {}: {} courses, {} rooms, {} faculty", snapshot.getId(),
                snapshot.getCourses().size(), snapshot.getRooms().size(), snapshot.getFaculty().size());
        return new CatalogPayload(snapshot.getCourses(), snapshot.getRooms(), snapshot.getFaculty(),
                snapshot.getPreferences(), null, snapshot.getDays(), snapshot.getPeriodsPerDay());
    }
}
