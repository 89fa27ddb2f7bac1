package com.sheetdoc.app.evaluation;

import com.sheetdoc.app.models.SheetData;

/**
 * What a resolver found for a page mention: the page id that keys its
 * evaluation cache, its title, and either its grid or an error.
 */
public class ExternalResolution {
    private final String pageId;
    private final String pageTitle;
    private final SheetData sheet;
    private final String error;

    public ExternalResolution(String pageId, String pageTitle, SheetData sheet, String error) {
        this.pageId = pageId;
        this.pageTitle = pageTitle;
        this.sheet = sheet;
        this.error = error;
    }

    public static ExternalResolution found(String pageId, String pageTitle, SheetData sheet) {
        return new ExternalResolution(pageId, pageTitle, sheet, null);
    }

    public static ExternalResolution failed(String pageId, String pageTitle, String error) {
        return new ExternalResolution(pageId, pageTitle, null, error);
    }

    public String getPageId() {
        return pageId;
    }

    public String getPageTitle() {
        return pageTitle;
    }

    public SheetData getSheet() {
        return sheet;
    }

    public String getError() {
        return error;
    }

    public boolean isAvailable() {
        return sheet != null && error == null;
    }
}
