package com.smartsched.timetable_engine.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * Read-only entity snapshot for one organization and term, as maintained by the data store.
 */
@Document("timetable_snapshots")
public class TimetableSnapshot {
    @Id
    private String id;
    private String organizationId;
    private String semester;
    private String academicYear;
    private List<Course> courses = new ArrayList<>();
    private List<Room> rooms = new ArrayList<>();
    private List<Faculty> faculty = new ArrayList<>();
    private List<DepartmentPreference> preferences = new ArrayList<>();
    private int days = 6;
    private int periodsPerDay = 9;

    public TimetableSnapshot() {}

    public TimetableSnapshot(String organizationId, String semester, String academicYear) {
        this.organizationId = organizationId;
        this.semester = semester;
        this.academicYear = academicYear;
    }

    // Getters
    public String getId() { return id; }
    public String getOrganizationId() { return organizationId; }
    public String getSemester() { return semester; }
    public String getAcademicYear() { return academicYear; }
    public List<Course> getCourses() { return courses; }
    public List<Room> getRooms() { return rooms; }
    public List<Faculty> getFaculty() { return faculty; }
    public List<DepartmentPreference> getPreferences() { return preferences; }
    public int getDays() { return days; }
    public int getPeriodsPerDay() { return periodsPerDay; }

    // Setters
    public void setId(String id) { this.id = id; }
    public void setOrganizationId(String organizationId) { this.organizationId = organizationId; }
    public void setSemester(String semester) { this.semester = semester; }
    public void setAcademicYear(String academicYear) { this.academicYear = academicYear; }
    public void setCourses(List<Course> courses) { this.courses = courses; }
    public void setRooms(List<Room> rooms) { this.rooms = rooms; }
    public void setFaculty(List<Faculty> faculty) { this.faculty = faculty; }
    public void setPreferences(List<DepartmentPreference> preferences) { this.preferences = preferences; }
    public void setDays(int days) { this.days = days; }
    public void setPeriodsPerDay(int periodsPerDay) { this.periodsPerDay = periodsPerDay; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TimetableSnapshot that = (TimetableSnapshot) o;
        if (id == null || that.id == null) {
            return false;
        }
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }
}
