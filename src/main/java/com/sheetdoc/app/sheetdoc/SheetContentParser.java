package com.sheetdoc.app.sheetdoc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sheetdoc.app.exceptions.InvalidCellAddressException;
import com.sheetdoc.app.exceptions.SheetDocFormatException;
import com.sheetdoc.app.models.CellAddress;
import com.sheetdoc.app.models.SheetData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Lenient reader for stored sheet content. Accepts a {@link SheetData}, SheetDoc
 * text, JSON text (plain or SheetDoc-shaped) or an already-parsed map, and
 * never throws: anything unreadable becomes an empty default sheet.
 */
public class SheetContentParser {

    private static final Logger logger = LoggerFactory.getLogger(SheetContentParser.class);

    private final SheetDocCodec codec;
    private final ObjectMapper objectMapper;

    public SheetContentParser(SheetDocCodec codec, ObjectMapper objectMapper) {
        this.codec = codec;
        this.objectMapper = objectMapper;
    }

    public SheetData parse(Object content) {
        if (content == null) {
            return SheetData.createEmpty();
        }
        if (content instanceof SheetData) {
            return ((SheetData) content).copy();
        }
        if (content instanceof String) {
            return parseText((String) content);
        }
        if (content instanceof Map) {
            return parseTree((Map<?, ?>) content);
        }
        logger.debug("Unsupported sheet content type {}, using an empty sheet", content.getClass().getName());
        return SheetData.createEmpty();
    }

    private SheetData parseText(String text) {
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            return SheetData.createEmpty();
        }

        if (SheetDocCodec.isSheetDocText(trimmed)) {
            try {
                return codec.toSheetData(codec.parse(trimmed));
            } catch (SheetDocFormatException e) {
                logger.debug("Unreadable SheetDoc, using an empty sheet: {}", e.getMessage());
                return SheetData.createEmpty();
            }
        }

        Object tree;
        try {
            tree = objectMapper.readValue(trimmed, Object.class);
        } catch (JsonProcessingException e) {
            logger.debug("Sheet content is neither SheetDoc nor JSON, using an empty sheet: {}",
                    e.getOriginalMessage());
            return SheetData.createEmpty();
        }
        // a JSON string may itself hold a document
        if (tree instanceof String && !((String) tree).trim().equals(trimmed)) {
            return parseText((String) tree);
        }
        if (tree instanceof Map) {
            return parseTree((Map<?, ?>) tree);
        }
        return SheetData.createEmpty();
    }

    @SuppressWarnings("unchecked")
    private SheetData parseTree(Map<?, ?> tree) {
        if (tree.get("sheets") instanceof List) {
            return codec.toSheetData(codec.normalize((Map<String, ?>) tree));
        }

        int version = tree.get("version") instanceof Number
                ? ((Number) tree.get("version")).intValue()
                : SheetData.VERSION;
        int rowCount = dimension(tree.get("rowCount"), SheetData.DEFAULT_ROWS);
        int columnCount = dimension(tree.get("columnCount"), SheetData.DEFAULT_COLUMNS);

        Map<String, String> cells = new TreeMap<>();
        if (tree.get("cells") instanceof Map) {
            ((Map<?, ?>) tree.get("cells")).forEach((key, value) -> {
                if (key != null && value != null) {
                    cells.put(String.valueOf(key).toUpperCase(), String.valueOf(value));
                }
            });
        }
        return new SheetData(version, rowCount, columnCount, cells);
    }

    private static int dimension(Object value, int fallback) {
        if (!(value instanceof Number) || !Double.isFinite(((Number) value).doubleValue())) {
            return fallback;
        }
        return (int) Math.max(1, Math.min(Integer.MAX_VALUE, Math.floor(((Number) value).doubleValue())));
    }

    /**
     * Copy of the sheet without keys that are not valid cell addresses
     * (wrong shape, row 0, or out of range).
     */
    public static SheetData sanitize(SheetData sheet) {
        Map<String, String> cells = new TreeMap<>();
        sheet.getCells().forEach((key, raw) -> {
            String address = CellAddress.normalize(key);
            if (address == null) {
                return;
            }
            try {
                CellAddress.decode(address);
                cells.put(address, raw);
            } catch (InvalidCellAddressException e) {
                logger.debug("Dropping cell {}: {}", key, e.getMessage());
            }
        });
        return new SheetData(sheet.getVersion(), sheet.getRowCount(), sheet.getColumnCount(), cells);
    }
}
