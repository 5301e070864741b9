package com.smartsched.timetable_engine.controller;

import java.util.List;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.smartsched.timetable_engine.dto.ConflictDetectionRequest;
import com.smartsched.timetable_engine.dto.ConflictResolutionRequest;
import com.smartsched.timetable_engine.dto.ConflictResolutionResponse;
import com.smartsched.timetable_engine.dto.CourseAdditionRequest;
import com.smartsched.timetable_engine.dto.CourseAdditionResponse;
import com.smartsched.timetable_engine.dto.CourseRemovalRequest;
import com.smartsched.timetable_engine.dto.CourseRemovalResponse;
import com.smartsched.timetable_engine.model.Conflict;
import com.smartsched.timetable_engine.service.ConflictService;
import com.smartsched.timetable_engine.service.IncrementalUpdateService;

import lombok.RequiredArgsConstructor;

/**
 * Steady-state maintenance of an existing assignment: conflict detection, resolution and
 * single-course updates.
 */
@RestController
@RequestMapping("/api/conflicts")
@RequiredArgsConstructor
public class ConflictController {

    private final ConflictService conflictService;
    private final IncrementalUpdateService incrementalUpdateService;

    @PostMapping("/detect")
    public ResponseEntity<List<Conflict>> detect(@RequestBody ConflictDetectionRequest request) {
        return ResponseEntity.ok(conflictService.detectConflicts(request));
    }

    @PostMapping("/resolve")
    public ResponseEntity<ConflictResolutionResponse> resolve(@RequestBody ConflictResolutionRequest request) {
        return ResponseEntity.ok(conflictService.resolve(request));
    }

    @PostMapping("/courses")
    public ResponseEntity<CourseAdditionResponse> addCourse(@RequestBody CourseAdditionRequest request) {
        return ResponseEntity.ok(incrementalUpdateService.addCourse(request));
    }

    @PutMapping("/courses")
    public ResponseEntity<CourseAdditionResponse> updateCourse(@RequestBody CourseAdditionRequest request) {
        return ResponseEntity.ok(incrementalUpdateService.updateCourse(request));
    }

    @PostMapping("/courses/remove")
    public ResponseEntity<CourseRemovalResponse> removeCourse(@RequestBody CourseRemovalRequest request) {
        return ResponseEntity.ok(incrementalUpdateService.removeCourse(request));
    }
}
