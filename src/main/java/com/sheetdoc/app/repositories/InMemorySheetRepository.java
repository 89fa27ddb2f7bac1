package com.sheetdoc.app.repositories;

import com.sheetdoc.app.models.Sheet;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * All sheets live here in memory; nothing survives a restart.
 */
@Repository
public class InMemorySheetRepository implements SheetRepository {

    // Generates unique IDs for newly saved sheets
    private final AtomicLong idGenerator = new AtomicLong(1);
    private final Map<Long, Sheet> sheets = new ConcurrentSkipListMap<>();

    @Override
    public Sheet save(Sheet sheet) {
        if (sheet.getId() == null) {
            sheet.setId(idGenerator.getAndIncrement());
        }
        sheets.put(sheet.getId(), sheet);
        return sheet;
    }

    @Override
    public Optional<Sheet> findById(long id) {
        return Optional.ofNullable(sheets.get(id));
    }

    /**
     * Every stored sheet, in ID order.
     */
    @Override
    public List<Sheet> findAll() {
        return new ArrayList<>(sheets.values());
    }
}
