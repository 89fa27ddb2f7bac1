package com.sheetdoc.app.repositories;

import com.sheetdoc.app.models.Sheet;

import java.util.List;
import java.util.Optional;

/**
 * Storage for sheet pages. Implementations assign an ID on first save.
 */
public interface SheetRepository {

    Sheet save(Sheet sheet);

    Optional<Sheet> findById(long id);

    List<Sheet> findAll();
}
