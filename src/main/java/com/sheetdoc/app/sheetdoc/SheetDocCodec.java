package com.sheetdoc.app.sheetdoc;

import com.sheetdoc.app.evaluation.EvalError;
import com.sheetdoc.app.evaluation.EvaluatedCell;
import com.sheetdoc.app.evaluation.EvaluationOptions;
import com.sheetdoc.app.evaluation.NumberFormatting;
import com.sheetdoc.app.evaluation.SheetEvaluation;
import com.sheetdoc.app.evaluation.SheetEvaluator;
import com.sheetdoc.app.exceptions.SheetDocFormatException;
import com.sheetdoc.app.models.CellAddress;
import com.sheetdoc.app.models.CellType;
import com.sheetdoc.app.models.CellValue;
import com.sheetdoc.app.models.DependencyRecord;
import com.sheetdoc.app.models.PageReference;
import com.sheetdoc.app.models.SheetData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tomlj.Toml;
import org.tomlj.TomlArray;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads and writes SheetDoc, the canonical text form of an evaluated sheet:
 * a magic header line followed by a TOML body.
 *
 * <pre>
 * #%PAGESPACE_SHEETDOC v1
 * page_id = "42"
 *
 * [[sheets]]
 * name = "Sheet1"
 * order = 0
 *
 * [sheets.meta]
 * row_count = 20
 * column_count = 10
 *
 * [sheets.cells.A1]
 * formula = "=B1*2"
 * value = 6
 * type = "number"
 *
 * [sheets.dependencies.A1]
 * depends_on = ["B1"]
 * dependents = []
 * </pre>
 *
 * Writing is deterministic: sheets are ordered by (order, name) and every
 * table by key, so the same logical content always gives the same bytes.
 */
public class SheetDocCodec {

    private static final Logger logger = LoggerFactory.getLogger(SheetDocCodec.class);

    public static final String DEFAULT_SHEET_NAME = "Sheet1";

    private static final List<String> RESERVED_META_KEYS =
            Arrays.asList("row_count", "column_count", "frozen_rows", "frozen_columns");

    private static final Pattern EXTERNAL_DEPENDENCY = Pattern.compile(
            "^@\\[([^\\]]+)\\](?:\\(([^):]*)(?::([^)]+))?\\))?:([A-Z]+\\d+)$", Pattern.CASE_INSENSITIVE);

    private final SheetEvaluator evaluator;

    public SheetDocCodec(SheetEvaluator evaluator) {
        this.evaluator = evaluator;
    }

    public static boolean isSheetDocText(String text) {
        return text != null && text.trim().startsWith(SheetDoc.MAGIC);
    }

    public String serialize(SheetData sheet) {
        return serialize(sheet, null, null, EvaluationOptions.standalone());
    }

    /**
     * Sanitizes and evaluates the sheet, then writes it as SheetDoc text.
     */
    public String serialize(SheetData sheet, String pageId, String sheetName, EvaluationOptions options) {
        SheetData sanitized = SheetContentParser.sanitize(sheet);
        SheetEvaluation evaluation = evaluator.evaluate(sanitized, options);
        return stringify(toSheetDoc(sanitized, evaluation, pageId, sheetName));
    }

    /**
     * Projects an evaluated sheet onto the document model. Formula cells keep
     * their text and the computed value ("" when the formula failed); plain
     * cells keep their typed value.
     */
    public SheetDoc toSheetDoc(SheetData sheet, SheetEvaluation evaluation, String pageId, String sheetName) {
        Map<String, SheetDocCell> cells = new TreeMap<>();
        Map<String, DependencyRecord> dependencies = new TreeMap<>();

        for (EvaluatedCell evaluated : evaluation.getByAddress().values()) {
            String address = evaluated.getAddress();
            String trimmed = sheet.getCell(address).trim();

            String formula = null;
            CellValue value = null;
            if (trimmed.startsWith("=")) {
                formula = trimmed;
                value = evaluated.hasError() ? CellValue.EMPTY : evaluated.getValue();
            } else if (!trimmed.isEmpty()) {
                value = evaluated.getValue();
            }

            String type = evaluated.getType() == CellType.EMPTY ? null : evaluated.getType().getWireName();
            SheetDocCellError error = evaluated.hasError() ? toDocError(address, evaluated.getEvalError()) : null;

            SheetDocCell cell = new SheetDocCell(formula, value, type, null, error);
            if (!cell.isEmpty()) {
                cells.put(address, cell);
            }

            if (!evaluated.getDependsOn().isEmpty() || !evaluated.getDependents().isEmpty()) {
                dependencies.put(address, new DependencyRecord(
                        uniqueSorted(evaluated.getDependsOn()), uniqueSorted(evaluated.getDependents())));
            }
        }

        SheetDocSheet docSheet = new SheetDocSheet(
                sheetName == null ? DEFAULT_SHEET_NAME : sheetName,
                0,
                new SheetMeta(sheet.getRowCount(), sheet.getColumnCount()),
                Collections.emptyMap(),
                cells,
                Collections.emptyMap(),
                dependencies);
        return new SheetDoc(pageId, Collections.singletonList(docSheet));
    }

    // A cell that only reads from a cycle inherits the cycle's error, and its
    // own address is still added to the details alongside the cycle members.
    private static SheetDocCellError toDocError(String address, EvalError error) {
        if (error.isCircular()) {
            List<String> members = new ArrayList<>(error.getCycle());
            members.add(address);
            return new SheetDocCellError(SheetDocCellError.CIRCULAR_REF, error.getMessage(), uniqueSorted(members));
        }
        return new SheetDocCellError(SheetDocCellError.EVAL_ERROR, error.getMessage(), null);
    }

    public String stringify(SheetDoc doc) {
        List<String> lines = new ArrayList<>();
        lines.add(SheetDoc.MAGIC + " " + SheetDoc.VERSION);
        if (doc.getPageId() != null && !doc.getPageId().isEmpty()) {
            lines.add("page_id = " + TomlWriter.string(doc.getPageId()));
        }

        for (SheetDocSheet sheet : doc.getSheets()) {
            lines.add("");
            lines.add("[[sheets]]");
            lines.add("name = " + TomlWriter.string(sheet.getName()));
            lines.add("order = " + sheet.getOrder());

            SheetMeta meta = sheet.getMeta();
            lines.add("");
            lines.add("[sheets.meta]");
            lines.add("row_count = " + meta.getRowCount());
            lines.add("column_count = " + meta.getColumnCount());
            if (meta.getFrozenRows() != null) {
                lines.add("frozen_rows = " + meta.getFrozenRows());
            }
            if (meta.getFrozenColumns() != null) {
                lines.add("frozen_columns = " + meta.getFrozenColumns());
            }
            meta.getExtras().forEach((key, value) ->
                    lines.add(TomlWriter.key(toSnakeCase(key)) + " = " + TomlWriter.value(value)));

            if (!sheet.getColumns().isEmpty()) {
                lines.add("");
                lines.add("[sheets.columns]");
                sheet.getColumns().forEach((key, attributes) ->
                        lines.add(TomlWriter.key(key) + " = " + TomlWriter.inlineTable(new TreeMap<>(attributes))));
            }

            sheet.getCells().forEach((address, cell) -> {
                lines.add("");
                lines.add("[sheets.cells." + TomlWriter.key(address) + "]");
                writeCell(cell, lines);
            });

            sheet.getRanges().forEach((key, range) -> {
                lines.add("");
                lines.add("[sheets.ranges." + TomlWriter.key(key) + "]");
                new TreeMap<>(range).forEach((property, value) ->
                        lines.add(TomlWriter.key(property) + " = " + TomlWriter.value(value)));
            });

            sheet.getDependencies().forEach((address, record) -> {
                lines.add("");
                lines.add("[sheets.dependencies." + TomlWriter.key(address) + "]");
                lines.add("depends_on = " + TomlWriter.value(record.getDependsOn()));
                lines.add("dependents = " + TomlWriter.value(record.getDependents()));
            });
        }

        lines.add("");
        return String.join("\n", lines);
    }

    private static void writeCell(SheetDocCell cell, List<String> lines) {
        if (cell.getFormula() != null) {
            lines.add("formula = " + TomlWriter.string(cell.getFormula()));
        }
        if (cell.getValue() != null) {
            lines.add("value = " + TomlWriter.value(cell.getValue()));
        }
        if (cell.getType() != null) {
            lines.add("type = " + TomlWriter.string(cell.getType()));
        }
        if (!cell.getNotes().isEmpty()) {
            lines.add("notes = " + TomlWriter.value(cell.getNotes()));
        }
        SheetDocCellError error = cell.getError();
        if (error != null) {
            // fixed key order: type, message, details
            Map<String, Object> record = new LinkedHashMap<>();
            record.put("type", error.getType());
            if (error.getMessage() != null && !error.getMessage().isEmpty()) {
                record.put("message", error.getMessage());
            }
            if (!error.getDetails().isEmpty()) {
                record.put("details", error.getDetails());
            }
            lines.add("error = " + TomlWriter.inlineTable(record));
        }
    }

    /**
     * Strict reader. The first non-blank line must be the magic header,
     * optionally followed by "v1"; the rest must be valid TOML.
     *
     * @throws SheetDocFormatException when the header or the body is malformed
     */
    public SheetDoc parse(String text) {
        String[] lines = text.split("\\r?\\n", -1);
        int headerIndex = -1;
        for (int i = 0; i < lines.length; i++) {
            if (!lines[i].trim().isEmpty()) {
                headerIndex = i;
                break;
            }
        }
        if (headerIndex < 0) {
            throw new SheetDocFormatException("Missing SheetDoc header");
        }

        String header = lines[headerIndex].trim();
        if (!header.startsWith(SheetDoc.MAGIC)) {
            throw new SheetDocFormatException("Invalid SheetDoc header");
        }
        String version = header.substring(SheetDoc.MAGIC.length()).trim();
        if (!version.isEmpty() && !version.equals(SheetDoc.VERSION)) {
            throw new SheetDocFormatException("Unsupported SheetDoc version: " + version);
        }

        String body = String.join("\n", Arrays.asList(lines).subList(headerIndex + 1, lines.length));
        if (body.trim().isEmpty()) {
            return normalize(Collections.emptyMap());
        }

        TomlParseResult result = Toml.parse(body);
        if (result.hasErrors()) {
            throw new SheetDocFormatException("Invalid SheetDoc body: " + result.errors().get(0).toString());
        }
        @SuppressWarnings("unchecked")
        Map<String, Object> tree = (Map<String, Object>) plain(result);
        return normalize(tree);
    }

    // TomlTable and TomlArray to plain maps and lists
    private static Object plain(Object node) {
        if (node instanceof TomlTable) {
            TomlTable table = (TomlTable) node;
            Map<String, Object> map = new LinkedHashMap<>();
            for (String key : table.keySet()) {
                map.put(key, plain(table.get(Collections.singletonList(key))));
            }
            return map;
        }
        if (node instanceof TomlArray) {
            TomlArray array = (TomlArray) node;
            List<Object> list = new ArrayList<>(array.size());
            for (int i = 0; i < array.size(); i++) {
                list.add(plain(array.get(i)));
            }
            return list;
        }
        return node;
    }

    /**
     * Builds a document from a parsed tree with snake_case keys, as produced
     * by the TOML body or by a SheetDoc-shaped JSON object. Anything that does
     * not fit is dropped rather than rejected.
     */
    public SheetDoc normalize(Map<String, ?> tree) {
        String pageId = tree.get("page_id") instanceof String ? (String) tree.get("page_id") : null;
        List<SheetDocSheet> sheets = new ArrayList<>();

        Object sheetsInput = tree.get("sheets");
        if (sheetsInput instanceof List) {
            List<?> inputs = (List<?>) sheetsInput;
            for (int index = 0; index < inputs.size(); index++) {
                if (inputs.get(index) instanceof Map) {
                    sheets.add(normalizeSheet((Map<?, ?>) inputs.get(index), index));
                }
            }
        }

        if (sheets.isEmpty()) {
            sheets.add(SheetDocSheet.empty(DEFAULT_SHEET_NAME, SheetData.DEFAULT_ROWS, SheetData.DEFAULT_COLUMNS));
        }
        return new SheetDoc(pageId, sheets);
    }

    private SheetDocSheet normalizeSheet(Map<?, ?> input, int index) {
        String name = input.get("name") instanceof String ? (String) input.get("name") : "Sheet " + (index + 1);
        Integer order = wholeNumber(input.get("order"));

        return new SheetDocSheet(
                name,
                order == null ? index : order,
                normalizeMeta(asMap(input.get("meta"))),
                normalizeColumns(asMap(input.get("columns"))),
                normalizeCells(asMap(input.get("cells"))),
                normalizeRanges(asMap(input.get("ranges"))),
                normalizeDependencies(asMap(input.get("dependencies"))));
    }

    private static SheetMeta normalizeMeta(Map<?, ?> input) {
        Integer rowCount = wholeNumber(input.get("row_count"));
        Integer columnCount = wholeNumber(input.get("column_count"));
        Integer frozenRows = wholeNumber(input.get("frozen_rows"));
        Integer frozenColumns = wholeNumber(input.get("frozen_columns"));

        Map<String, Object> extras = new TreeMap<>();
        input.forEach((key, value) -> {
            String name = String.valueOf(key);
            Object primitive = primitive(value);
            if (RESERVED_META_KEYS.contains(name) || primitive == null) {
                return;
            }
            String camel = toCamelCase(name);
            if (!RESERVED_META_KEYS.contains(toSnakeCase(camel))) {
                extras.put(camel, primitive);
            }
        });

        return new SheetMeta(
                rowCount == null ? SheetData.DEFAULT_ROWS : rowCount,
                columnCount == null ? SheetData.DEFAULT_COLUMNS : columnCount,
                frozenRows == null ? null : Math.max(0, frozenRows),
                frozenColumns == null ? null : Math.max(0, frozenColumns),
                extras);
    }

    private static Map<String, Map<String, Object>> normalizeColumns(Map<?, ?> input) {
        Map<String, Map<String, Object>> columns = new TreeMap<>();
        input.forEach((key, value) -> {
            if (!(value instanceof Map)) {
                return;
            }
            Map<String, Object> attributes = new TreeMap<>();
            ((Map<?, ?>) value).forEach((property, attribute) -> {
                Object primitive = primitive(attribute);
                if (primitive != null) {
                    attributes.put(String.valueOf(property), primitive);
                }
            });
            if (!attributes.isEmpty()) {
                columns.put(String.valueOf(key).toUpperCase(), attributes);
            }
        });
        return columns;
    }

    private static Map<String, SheetDocCell> normalizeCells(Map<?, ?> input) {
        Map<String, SheetDocCell> cells = new TreeMap<>();
        input.forEach((key, value) -> {
            String address = CellAddress.normalize(String.valueOf(key));
            if (address == null || !(value instanceof Map)) {
                return;
            }
            Map<?, ?> source = (Map<?, ?>) value;

            String formula = source.get("formula") instanceof String
                    ? ((String) source.get("formula")).trim()
                    : null;
            CellValue cellValue = source.containsKey("value") ? cellValue(source.get("value")) : null;
            String type = source.get("type") instanceof String && !((String) source.get("type")).isEmpty()
                    ? (String) source.get("type")
                    : null;
            List<String> notes = strings(source.get("notes"));
            SheetDocCellError error = source.get("error") instanceof Map
                    ? normalizeError((Map<?, ?>) source.get("error"))
                    : null;

            SheetDocCell cell = new SheetDocCell(formula == null || formula.isEmpty() ? null : formula,
                    cellValue, type, notes, error);
            if (!cell.isEmpty()) {
                cells.put(address, cell);
            }
        });
        return cells;
    }

    private static SheetDocCellError normalizeError(Map<?, ?> input) {
        String type = input.get("type") instanceof String ? (String) input.get("type") : null;
        String message = input.get("message") instanceof String ? (String) input.get("message") : null;
        List<String> details = strings(input.get("details"));
        if (type == null && message == null && details.isEmpty()) {
            return null;
        }
        return new SheetDocCellError(type == null ? SheetDocCellError.EVAL_ERROR : type,
                message == null || message.isEmpty() ? null : message,
                uniqueSorted(details));
    }

    private static Map<String, Map<String, Object>> normalizeRanges(Map<?, ?> input) {
        Map<String, Map<String, Object>> ranges = new TreeMap<>();
        input.forEach((key, value) -> {
            if (value instanceof Map) {
                ranges.put(String.valueOf(key), plainCopy((Map<?, ?>) value));
            }
        });
        return ranges;
    }

    private static Map<String, DependencyRecord> normalizeDependencies(Map<?, ?> input) {
        Map<String, DependencyRecord> dependencies = new TreeMap<>();
        input.forEach((key, value) -> {
            String address = CellAddress.normalize(String.valueOf(key));
            if (address == null || !(value instanceof Map)) {
                return;
            }
            Map<?, ?> source = (Map<?, ?>) value;
            dependencies.put(address, new DependencyRecord(
                    dependencyKeys(source.get("depends_on")),
                    dependencyKeys(source.get("dependents"))));
        });
        return dependencies;
    }

    private static List<String> dependencyKeys(Object input) {
        List<String> keys = new ArrayList<>();
        for (String reference : strings(input)) {
            String normalized = normalizeDependencyReference(reference);
            if (normalized != null) {
                keys.add(normalized);
            }
        }
        return uniqueSorted(keys);
    }

    /**
     * "b2" becomes "B2"; "@[Budget](p1):b2" becomes "@[Budget](p1):B2".
     * Returns null for anything that is neither.
     */
    static String normalizeDependencyReference(String reference) {
        String trimmed = reference.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        String address = CellAddress.normalize(trimmed);
        if (address != null) {
            return address;
        }
        Matcher matcher = EXTERNAL_DEPENDENCY.matcher(trimmed);
        if (!matcher.matches() || matcher.group(1).trim().isEmpty()) {
            return null;
        }
        return new PageReference(matcher.group(1), matcher.group(2), matcher.group(3)).formatCell(matcher.group(4));
    }

    /**
     * Rebuilds the editable grid from the first sheet of the document.
     * Formulas win over values; other sheets are ignored.
     */
    public SheetData toSheetData(SheetDoc doc) {
        if (doc.getSheets().isEmpty()) {
            return SheetData.createEmpty();
        }
        SheetDocSheet target = doc.getSheets().get(0);
        Map<String, String> cells = new TreeMap<>();

        target.getCells().forEach((key, cell) -> {
            String address = CellAddress.normalize(key);
            if (address == null) {
                return;
            }
            if (cell.getFormula() != null && !cell.getFormula().trim().isEmpty()) {
                String formula = cell.getFormula().trim();
                cells.put(address, formula.startsWith("=") ? formula : "=" + formula);
            } else if (cell.getValue() != null) {
                String raw = rawText(cell.getValue());
                if (!raw.isEmpty()) {
                    cells.put(address, raw);
                }
            }
        });

        if (doc.getSheets().size() > 1) {
            logger.debug("SheetDoc has {} sheets, only {} is loaded", doc.getSheets().size(), target.getName());
        }
        return new SheetData(SheetData.VERSION, target.getMeta().getRowCount(), target.getMeta().getColumnCount(),
                cells);
    }

    private static String rawText(CellValue value) {
        switch (value.getType()) {
            case NUMBER:
                return Double.isFinite(value.asNumber()) ? NumberFormatting.canonical(value.asNumber()) : "";
            case BOOLEAN:
                return value.asBoolean() ? "true" : "false";
            case STRING:
                return value.asString();
            default:
                return "";
        }
    }

    private static Map<?, ?> asMap(Object value) {
        return value instanceof Map ? (Map<?, ?>) value : Collections.emptyMap();
    }

    private static Integer wholeNumber(Object value) {
        if (!(value instanceof Number)) {
            return null;
        }
        double number = ((Number) value).doubleValue();
        if (!Double.isFinite(number)) {
            return null;
        }
        return (int) Math.max(Integer.MIN_VALUE, Math.min(Integer.MAX_VALUE, Math.floor(number)));
    }

    // String, Long, Double or Boolean; null for anything else
    private static Object primitive(Object value) {
        if (value instanceof String || value instanceof Boolean) {
            return value;
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof Number) {
            double number = ((Number) value).doubleValue();
            return Double.isFinite(number) ? number : null;
        }
        return null;
    }

    private static CellValue cellValue(Object value) {
        if (value == null) {
            return CellValue.EMPTY;
        }
        if (value instanceof Boolean) {
            return CellValue.bool((Boolean) value);
        }
        if (value instanceof String) {
            return CellValue.string((String) value);
        }
        if (value instanceof Number) {
            double number = ((Number) value).doubleValue();
            return Double.isFinite(number) ? CellValue.number(number) : null;
        }
        return null;
    }

    private static Map<String, Object> plainCopy(Map<?, ?> source) {
        Map<String, Object> copy = new TreeMap<>();
        source.forEach((key, value) -> {
            Object plainValue = plainValue(value);
            if (plainValue != null) {
                copy.put(String.valueOf(key), plainValue);
            }
        });
        return copy;
    }

    private static Object plainValue(Object value) {
        if (value instanceof Map) {
            return plainCopy((Map<?, ?>) value);
        }
        if (value instanceof List) {
            List<Object> items = new ArrayList<>();
            for (Object item : (List<?>) value) {
                Object plainItem = plainValue(item);
                if (plainItem != null) {
                    items.add(plainItem);
                }
            }
            return items;
        }
        return primitive(value);
    }

    private static List<String> strings(Object value) {
        List<String> result = new ArrayList<>();
        if (value instanceof List) {
            for (Object item : (List<?>) value) {
                if (item instanceof String) {
                    result.add((String) item);
                }
            }
        }
        return result;
    }

    private static List<String> uniqueSorted(List<String> values) {
        return new ArrayList<>(new TreeSet<>(values));
    }

    static String toCamelCase(String key) {
        StringBuilder camel = new StringBuilder();
        for (int i = 0; i < key.length(); i++) {
            char c = key.charAt(i);
            if (c == '_' && i + 1 < key.length() && Character.isLowerCase(key.charAt(i + 1))) {
                camel.append(Character.toUpperCase(key.charAt(++i)));
            } else {
                camel.append(c);
            }
        }
        return camel.toString();
    }

    static String toSnakeCase(String key) {
        StringBuilder snake = new StringBuilder();
        for (char c : key.toCharArray()) {
            if (Character.isUpperCase(c)) {
                snake.append('_').append(Character.toLowerCase(c));
            } else {
                snake.append(c);
            }
        }
        return snake.toString();
    }
}
