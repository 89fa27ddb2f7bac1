package com.sheetdoc.app.evaluation.functions;

import com.sheetdoc.app.evaluation.EvalError;
import com.sheetdoc.app.evaluation.Result;
import com.sheetdoc.app.models.CellValue;

import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.chrono.IsoChronology;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.function.ToIntFunction;

/**
 * Dates are plain ISO-8601 text: TODAY gives "2024-03-09", NOW gives a UTC
 * timestamp with milliseconds.
 */
final class DateFunctions {

    static final DateTimeFormatter NOW_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'");

    private static final DateTimeFormatter DATE_INPUT = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .optionalStart()
            .appendLiteral('T')
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .optionalStart()
            .appendOffsetId()
            .optionalEnd()
            .optionalEnd()
            .toFormatter()
            .withChronology(IsoChronology.INSTANCE)
            .withResolverStyle(ResolverStyle.STRICT);

    private DateFunctions() {
    }

    static void register(FunctionLibrary library, Clock clock) {
        library.register("TODAY", args -> Checks.text(LocalDate.now(clock).toString()));
        library.register("NOW", args -> Checks.text(NOW_FORMAT.format(OffsetDateTime.now(clock)
                .withOffsetSameInstant(ZoneOffset.UTC))));
        library.register("YEAR", args -> part(args, "YEAR", LocalDate::getYear));
        library.register("MONTH", args -> part(args, "MONTH", LocalDate::getMonthValue));
        library.register("DAY", args -> part(args, "DAY", LocalDate::getDayOfMonth));
    }

    private static Result<CellValue> part(FunctionArguments args, String name, ToIntFunction<LocalDate> field) {
        return args.values().flatMap(values -> {
            EvalError arity = Checks.arity(name, values.size(), 1, 1, "exactly one argument");
            if (arity != null) {
                return Result.fail(arity);
            }
            LocalDate date = parseDate(Checks.textOf(values.get(0)));
            if (date == null) {
                return Result.fail(EvalError.invalidArgument(name + ": Invalid date"));
            }
            return Checks.number(field.applyAsInt(date));
        });
    }

    /**
     * Accepts "2024-03-09", "2024-03-09T10:15:30" and offset timestamps such
     * as NOW() output. Returns null for anything else.
     */
    static LocalDate parseDate(String text) {
        try {
            return DATE_INPUT.parse(text.trim(), LocalDate::from);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
