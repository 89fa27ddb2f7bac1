package com.sheetdoc.app.models;

import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * A stored sheet page:
 * - an ID assigned by the repository
 * - a title other sheets can mention it by, e.g. @[Budget]:B2
 * - the editable grid (SheetData)
 * - a read/write lock serializing edits against reads of the grid
 */
public class Sheet {

    private Long id;
    private String title;
    private SheetData data;

    // Lock to prevent race conditions when multiple threads update the same Sheet
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public Sheet(String title, SheetData data) {
        this.title = title;
        this.data = data;
    }

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    /**
     * The live grid. Callers hold the lock while reading or replacing it.
     */
    public SheetData getData() {
        return data;
    }

    public void setData(SheetData data) {
        this.data = data;
    }

    /**
     * Copy of the grid taken under the read lock.
     */
    public SheetData snapshot() {
        lock.readLock().lock();
        try {
            return data.copy();
        } finally {
            lock.readLock().unlock();
        }
    }

    public ReentrantReadWriteLock getLock() {
        return lock;
    }
}
