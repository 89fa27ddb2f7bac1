package com.sheetdoc.app.evaluation;

import com.sheetdoc.app.models.PageReference;
import com.sheetdoc.app.models.SheetData;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * State of one evaluation pass, allocated per pass and passed explicitly:
 * - one result cache per page key
 * - the grid and title of every page seen so far
 * - resolver answers keyed by raw mention, so each mention resolves once
 * - the ancestor path of (page, address) frames currently being evaluated
 */
public final class EvaluationContext {

    public static final String LOCAL_PAGE_KEY = "__LOCAL_PAGE__";

    private final String localPageKey;
    private final ExternalReferenceResolver resolver;
    private final Map<String, Map<String, EvaluatedCell>> caches = new HashMap<>();
    private final Map<String, SheetData> sheets = new HashMap<>();
    private final Map<String, String> pageTitles = new HashMap<>();
    private final Map<String, ExternalResolution> resolutions = new HashMap<>();
    // frame key -> display name, in recursion order
    private final LinkedHashMap<String, String> ancestors = new LinkedHashMap<>();

    public EvaluationContext(SheetData sheet, EvaluationOptions options) {
        this.localPageKey = options.getPageId() == null ? LOCAL_PAGE_KEY : options.getPageId();
        this.resolver = options.getResolver();
        sheets.put(localPageKey, sheet);
        caches.put(localPageKey, new HashMap<>());
        pageTitles.put(localPageKey, options.getPageTitle() == null ? "Sheet" : options.getPageTitle());
    }

    public String getLocalPageKey() {
        return localPageKey;
    }

    SheetData sheet(String pageKey) {
        SheetData sheet = sheets.get(pageKey);
        if (sheet == null) {
            throw new IllegalStateException("Missing sheet data for page " + pageKey);
        }
        return sheet;
    }

    EvaluatedCell cached(String pageKey, String address) {
        return caches.computeIfAbsent(pageKey, key -> new HashMap<>()).get(address);
    }

    void cache(String pageKey, EvaluatedCell cell) {
        caches.computeIfAbsent(pageKey, key -> new HashMap<>()).put(cell.getAddress(), cell);
    }

    boolean isInProgress(String pageKey, String address) {
        return ancestors.containsKey(frameKey(pageKey, address));
    }

    void enter(String pageKey, String address) {
        ancestors.put(frameKey(pageKey, address), frameName(pageKey, address));
    }

    void exit(String pageKey, String address) {
        ancestors.remove(frameKey(pageKey, address));
    }

    /**
     * Frames from the re-entered one to the innermost, i.e. the members of the cycle.
     */
    List<String> cycleFrom(String pageKey, String address) {
        String start = frameKey(pageKey, address);
        List<String> members = new ArrayList<>();
        boolean inCycle = false;
        for (Map.Entry<String, String> frame : ancestors.entrySet()) {
            if (frame.getKey().equals(start)) {
                inCycle = true;
            }
            if (inCycle) {
                members.add(frame.getValue());
            }
        }
        return members;
    }

    /**
     * Resolves a mention at most once per pass. Never returns null.
     */
    ExternalResolution resolve(PageReference page) {
        ExternalResolution known = resolutions.get(page.getRaw());
        if (known != null) {
            return known;
        }

        String fallbackId = page.getIdentifier() == null ? page.getRaw() : page.getIdentifier();
        ExternalResolution resolution;
        if (resolver == null) {
            resolution = ExternalResolution.failed(fallbackId, page.getLabel(),
                    "Cross-page references are not supported in this context");
        } else {
            ExternalResolution provided = resolver.resolve(page);
            if (provided == null) {
                resolution = ExternalResolution.failed(fallbackId, page.getLabel(),
                        "Referenced page \"" + page.getLabel() + "\" is not available");
            } else {
                resolution = new ExternalResolution(
                        isBlank(provided.getPageId()) ? fallbackId : provided.getPageId(),
                        isBlank(provided.getPageTitle()) ? page.getLabel() : provided.getPageTitle(),
                        provided.getSheet(),
                        provided.getError());
            }
        }

        resolutions.put(page.getRaw(), resolution);
        if (resolution.getSheet() != null) {
            sheets.putIfAbsent(resolution.getPageId(), resolution.getSheet());
            caches.computeIfAbsent(resolution.getPageId(), key -> new HashMap<>());
            pageTitles.putIfAbsent(resolution.getPageId(), resolution.getPageTitle());
        }
        return resolution;
    }

    private String frameKey(String pageKey, String address) {
        return pageKey + "|" + address;
    }

    private String frameName(String pageKey, String address) {
        if (pageKey.equals(localPageKey)) {
            return address;
        }
        return new PageReference(pageTitles.getOrDefault(pageKey, pageKey), pageKey, null).formatCell(address);
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
