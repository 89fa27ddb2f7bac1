package com.sheetdoc.app.evaluation;

/**
 * Per-pass settings: the id and title of the page being evaluated, and an
 * optional resolver for references to other pages.
 */
public class EvaluationOptions {
    private final String pageId;
    private final String pageTitle;
    private final ExternalReferenceResolver resolver;

    public EvaluationOptions(String pageId, String pageTitle, ExternalReferenceResolver resolver) {
        this.pageId = pageId;
        this.pageTitle = pageTitle;
        this.resolver = resolver;
    }

    /**
     * A standalone document: no page id and no cross-page references.
     */
    public static EvaluationOptions standalone() {
        return new EvaluationOptions(null, null, null);
    }

    public String getPageId() {
        return pageId;
    }

    public String getPageTitle() {
        return pageTitle;
    }

    public ExternalReferenceResolver getResolver() {
        return resolver;
    }
}
