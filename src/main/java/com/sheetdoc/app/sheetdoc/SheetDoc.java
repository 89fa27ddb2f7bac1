package com.sheetdoc.app.sheetdoc;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * A parsed or generated SheetDoc: an optional page id plus one or more sheets,
 * kept sorted by (order, name).
 */
public class SheetDoc {

    public static final String MAGIC = "#%PAGESPACE_SHEETDOC";
    public static final String VERSION = "v1";

    private static final Comparator<SheetDocSheet> SHEET_ORDER =
            Comparator.comparingInt(SheetDocSheet::getOrder).thenComparing(SheetDocSheet::getName);

    private final String pageId;
    private final List<SheetDocSheet> sheets;

    public SheetDoc(String pageId, List<SheetDocSheet> sheets) {
        this.pageId = pageId;
        List<SheetDocSheet> sorted = new ArrayList<>(sheets);
        sorted.sort(SHEET_ORDER);
        this.sheets = Collections.unmodifiableList(sorted);
    }

    public String getVersion() {
        return VERSION;
    }

    public String getPageId() {
        return pageId;
    }

    public List<SheetDocSheet> getSheets() {
        return sheets;
    }
}
