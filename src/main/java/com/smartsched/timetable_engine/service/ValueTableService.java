package com.smartsched.timetable_engine.service;

import java.time.Instant;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import com.smartsched.timetable_engine.config.EngineSettings;
import com.smartsched.timetable_engine.model.LearnedValueTable;
import com.smartsched.timetable_engine.repository.ValueTableRepository;
import com.smartsched.timetable_engine.solver.repair.ValueTable;

import lombok.RequiredArgsConstructor;

/**
 * Loads and stores the repair value table per organization and semester. A store outage only
 * costs the warm start: loading falls back to an empty table and a failed save is logged.
 */
@Service
@RequiredArgsConstructor
public class ValueTableService {

    private static final Logger logger = LoggerFactory.getLogger(ValueTableService.class);

    private final ValueTableRepository valueTableRepository;
    private final EngineSettings settings;

    public ValueTable load(String organizationId, String semester) {
        if (organizationId == null || semester == null) {
            return emptyTable();
        }
        try {
            return valueTableRepository.findFirstByOrganizationIdAndSemester(organizationId, semester)
                    .map(stored -> {
                        logger.info("Transferring {} learned values for {}/{}", stored.getEntries().size(),
                                organizationId, semester);
                        return ValueTable.transferredFrom(stored.getEntries(), settings.getAlphaNew(),
                                settings.getAlphaTransferred(), settings.getGamma());
                    })
                    .orElseGet(this::emptyTable);
        } catch (DataAccessException e) {
            logger.warn("!!! Could not load value table for {}/{}, starting cold: {}", organizationId, semester,
                    e.getMessage());
            return emptyTable();
        }
    }

    public void save(String organizationId, String semester, ValueTable table) {
        if (organizationId == null || semester == null || table.isEmpty()) {
            return;
        }
        try {
            LearnedValueTable stored = valueTableRepository.findFirstByOrganizationIdAndSemester(organizationId, semester)
                    .orElseGet(() -> new LearnedValueTable(organizationId, semester));
            stored.setEntries(table.export());
            stored.setUpdatedAt(Instant.now());
            valueTableRepository.save(stored);
            logger.info("Saved {} learned values for {}/{}", table.size(), organizationId, semester);
        } catch (DataAccessException e) {
            logger.warn("!!! Could not save value table for {}/{}: {}", organizationId, semester, e.getMessage());
        }
    }

    private ValueTable emptyTable() {
        return new ValueTable(settings.getAlphaNew(), settings.getAlphaTransferred(), settings.getGamma());
    }
}
