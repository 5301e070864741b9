package com.smartsched.timetable_engine.model;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * Persisted repair value table, transferred between runs of the same organization and semester.
 * Keys are state/action signatures and must not contain '.' or '$'.
 */
@Document("learned_value_tables")
public class LearnedValueTable {
    @Id
    private String id;
    private String organizationId;
    private String semester;
    private Map<String, Double> entries = new HashMap<>();
    private Instant updatedAt;

    public LearnedValueTable() {}

    public LearnedValueTable(String organizationId, String semester) {
        this.organizationId = organizationId;
        this.semester = semester;
    }

    // Getters
    public String getId() { return id; }
    public String getOrganizationId() { return organizationId; }
    public String getSemester() { return semester; }
    public Map<String, Double> getEntries() { return entries; }
    public Instant getUpdatedAt() { return updatedAt; }

    // Setters
    public void setId(String id) { this.id = id; }
    public void setOrganizationId(String organizationId) { this.organizationId = organizationId; }
    public void setSemester(String semester) { this.semester = semester; }
    public void setEntries(Map<String, Double> entries) { this.entries = entries; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        LearnedValueTable that = (LearnedValueTable) o;
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
