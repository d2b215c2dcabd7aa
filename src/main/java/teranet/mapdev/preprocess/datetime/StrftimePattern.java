package teranet.mapdev.preprocess.datetime;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.format.SignStyle;
import java.time.format.TextStyle;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;
import java.time.temporal.TemporalField;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * A strftime-style format string ("%Y-%m-%d %H:%M:%S") compiled to java.time formatters.
 *
 * Supported directives:
 * <pre>
 *   %Y  4-digit year          %y  2-digit year (69-99 -> 19xx, 00-68 -> 20xx)
 *   %m  month 01-12           %d  day of month 01-31
 *   %H  hour 00-23            %I  hour 01-12       %p  AM/PM
 *   %M  minute 00-59          %S  second 00-59     %f  microseconds (1-6 digits in, 6 out)
 *   %j  day of year 001-366
 *   %b  Jan                   %B  January
 *   %a  Mon                   %A  Monday
 *   %F  = %Y-%m-%d            %T  = %H:%M:%S       %D  = %m/%d/%y
 *   %%  literal percent
 * </pre>
 * Any other directive (including %z and %Z) is rejected at compile time.
 *
 * Parsing is strict: the whole text must match and the date must exist.
 * Fields missing from the pattern default to 1900-01-01 00:00:00.
 * As with strptime, a parsed weekday is not checked against the date, and %p only
 * applies to %I.
 * Month and day names are English.
 */
public final class StrftimePattern {

    private static final int DEFAULT_YEAR = 1900;
    private static final int TWO_DIGIT_YEAR_BASE = 1969;

    private final String format;
    private final DateTimeFormatter parser;
    private final DateTimeFormatter printer;

    private StrftimePattern(String format, DateTimeFormatter parser, DateTimeFormatter printer) {
        this.format = format;
        this.parser = parser;
        this.printer = printer;
    }

    /**
     * Compile a format string.
     *
     * @param format strftime-style format
     * @return compiled pattern
     * @throws IllegalArgumentException if the format is empty or has an unsupported directive
     */
    public static StrftimePattern compile(String format) {
        if (format == null || format.isEmpty()) {
            throw new IllegalArgumentException("Datetime format is empty");
        }
        String expanded = expandShortcuts(format);

        DateTimeFormatterBuilder parse = new DateTimeFormatterBuilder().parseCaseInsensitive();
        DateTimeFormatterBuilder print = new DateTimeFormatterBuilder();
        Set<ChronoField> fields = EnumSet.noneOf(ChronoField.class);
        StringBuilder literal = new StringBuilder();

        for (int i = 0; i < expanded.length(); i++) {
            char c = expanded.charAt(i);
            if (c != '%') {
                literal.append(c);
                continue;
            }
            if (i + 1 >= expanded.length()) {
                throw new IllegalArgumentException("Dangling '%' at end of format: " + format);
            }
            char directive = expanded.charAt(++i);
            if (directive == '%') {
                literal.append('%');
                continue;
            }
            flushLiteral(literal, parse, print);
            switch (directive) {
                case 'Y':
                    parse.appendValue(ChronoField.YEAR, 4);
                    print.appendValue(ChronoField.YEAR, 4);
                    fields.add(ChronoField.YEAR);
                    break;
                case 'y':
                    parse.appendValueReduced(ChronoField.YEAR, 2, 2, TWO_DIGIT_YEAR_BASE);
                    print.appendValueReduced(ChronoField.YEAR, 2, 2, TWO_DIGIT_YEAR_BASE);
                    fields.add(ChronoField.YEAR);
                    break;
                case 'm':
                    appendNumber(parse, print, ChronoField.MONTH_OF_YEAR, 2);
                    fields.add(ChronoField.MONTH_OF_YEAR);
                    break;
                case 'b':
                    appendName(parse, print, ChronoField.MONTH_OF_YEAR, TextStyle.SHORT);
                    fields.add(ChronoField.MONTH_OF_YEAR);
                    break;
                case 'B':
                    appendName(parse, print, ChronoField.MONTH_OF_YEAR, TextStyle.FULL);
                    fields.add(ChronoField.MONTH_OF_YEAR);
                    break;
                case 'd':
                    appendNumber(parse, print, ChronoField.DAY_OF_MONTH, 2);
                    fields.add(ChronoField.DAY_OF_MONTH);
                    break;
                case 'j':
                    appendNumber(parse, print, ChronoField.DAY_OF_YEAR, 3);
                    fields.add(ChronoField.DAY_OF_YEAR);
                    break;
                case 'a':
                    appendName(parse, print, ChronoField.DAY_OF_WEEK, TextStyle.SHORT);
                    break;
                case 'A':
                    appendName(parse, print, ChronoField.DAY_OF_WEEK, TextStyle.FULL);
                    break;
                case 'H':
                    appendNumber(parse, print, ChronoField.HOUR_OF_DAY, 2);
                    fields.add(ChronoField.HOUR_OF_DAY);
                    break;
                case 'I':
                    appendNumber(parse, print, ChronoField.CLOCK_HOUR_OF_AMPM, 2);
                    fields.add(ChronoField.CLOCK_HOUR_OF_AMPM);
                    break;
                case 'p':
                    appendName(parse, print, ChronoField.AMPM_OF_DAY, TextStyle.SHORT);
                    fields.add(ChronoField.AMPM_OF_DAY);
                    break;
                case 'M':
                    appendNumber(parse, print, ChronoField.MINUTE_OF_HOUR, 2);
                    fields.add(ChronoField.MINUTE_OF_HOUR);
                    break;
                case 'S':
                    appendNumber(parse, print, ChronoField.SECOND_OF_MINUTE, 2);
                    fields.add(ChronoField.SECOND_OF_MINUTE);
                    break;
                case 'f':
                    parse.appendFraction(ChronoField.MICRO_OF_SECOND, 1, 6, false);
                    print.appendFraction(ChronoField.MICRO_OF_SECOND, 6, 6, false);
                    break;
                default:
                    throw new IllegalArgumentException(String.format(
                            "Unsupported directive '%%%c' in datetime format: %s", directive, format));
            }
        }
        flushLiteral(literal, parse, print);
        applyDefaults(parse, fields);

        DateTimeFormatter parser = parse.toFormatter(Locale.ENGLISH)
                .withResolverStyle(ResolverStyle.STRICT)
                .withResolverFields(resolverFields(fields));
        DateTimeFormatter printer = print.toFormatter(Locale.ENGLISH);
        return new StrftimePattern(format, parser, printer);
    }

    /**
     * Parse text into a local date-time.
     *
     * @throws DateTimeParseException if the text does not match or names an invalid date
     */
    public LocalDateTime parse(CharSequence text) {
        return parser.parse(text, LocalDateTime::from);
    }

    /**
     * Render a date-time with this pattern.
     *
     * @throws java.time.DateTimeException if a field cannot be printed (e.g. a 5-digit year)
     */
    public String format(TemporalAccessor dateTime) {
        return printer.format(dateTime);
    }

    public String getFormat() {
        return format;
    }

    private static String expandShortcuts(String format) {
        StringBuilder out = new StringBuilder(format.length() + 16);
        for (int i = 0; i < format.length(); i++) {
            char c = format.charAt(i);
            if (c == '%' && i + 1 < format.length()) {
                char next = format.charAt(i + 1);
                switch (next) {
                    case 'F':
                        out.append("%Y-%m-%d");
                        i++;
                        continue;
                    case 'T':
                        out.append("%H:%M:%S");
                        i++;
                        continue;
                    case 'D':
                        out.append("%m/%d/%y");
                        i++;
                        continue;
                    default:
                        // keep the pair together so "%%F" stays a literal "%F"
                        out.append(c).append(next);
                        i++;
                        continue;
                }
            }
            out.append(c);
        }
        return out.toString();
    }

    private static void appendNumber(DateTimeFormatterBuilder parse, DateTimeFormatterBuilder print,
            ChronoField field, int width) {
        parse.appendValue(field, 1, width, SignStyle.NOT_NEGATIVE);
        print.appendValue(field, width);
    }

    private static void appendName(DateTimeFormatterBuilder parse, DateTimeFormatterBuilder print,
            ChronoField field, TextStyle style) {
        parse.appendText(field, style);
        print.appendText(field, style);
    }

    private static void flushLiteral(StringBuilder literal, DateTimeFormatterBuilder parse,
            DateTimeFormatterBuilder print) {
        if (literal.length() > 0) {
            parse.appendLiteral(literal.toString());
            print.appendLiteral(literal.toString());
            literal.setLength(0);
        }
    }

    // DAY_OF_WEEK never takes part, AMPM_OF_DAY only together with %I
    private static Set<TemporalField> resolverFields(Set<ChronoField> fields) {
        Set<TemporalField> resolved = new HashSet<>(Set.of(
                ChronoField.YEAR, ChronoField.MONTH_OF_YEAR, ChronoField.DAY_OF_MONTH,
                ChronoField.DAY_OF_YEAR, ChronoField.HOUR_OF_DAY, ChronoField.CLOCK_HOUR_OF_AMPM,
                ChronoField.MINUTE_OF_HOUR, ChronoField.SECOND_OF_MINUTE, ChronoField.MICRO_OF_SECOND));
        if (fields.contains(ChronoField.CLOCK_HOUR_OF_AMPM)) {
            resolved.add(ChronoField.AMPM_OF_DAY);
        }
        return resolved;
    }

    // strptime fills absent fields from 1900-01-01T00:00:00
    private static void applyDefaults(DateTimeFormatterBuilder parse, Set<ChronoField> fields) {
        if (!fields.contains(ChronoField.YEAR)) {
            parse.parseDefaulting(ChronoField.YEAR, DEFAULT_YEAR);
        }
        if (!fields.contains(ChronoField.DAY_OF_YEAR)) {
            if (!fields.contains(ChronoField.MONTH_OF_YEAR)) {
                parse.parseDefaulting(ChronoField.MONTH_OF_YEAR, 1);
            }
            if (!fields.contains(ChronoField.DAY_OF_MONTH)) {
                parse.parseDefaulting(ChronoField.DAY_OF_MONTH, 1);
            }
        }
        if (fields.contains(ChronoField.CLOCK_HOUR_OF_AMPM)) {
            if (!fields.contains(ChronoField.AMPM_OF_DAY)) {
                parse.parseDefaulting(ChronoField.AMPM_OF_DAY, 0);
            }
        } else if (!fields.contains(ChronoField.HOUR_OF_DAY)) {
            parse.parseDefaulting(ChronoField.HOUR_OF_DAY, 0);
        }
        if (!fields.contains(ChronoField.MINUTE_OF_HOUR)) {
            parse.parseDefaulting(ChronoField.MINUTE_OF_HOUR, 0);
        }
        if (!fields.contains(ChronoField.SECOND_OF_MINUTE)) {
            parse.parseDefaulting(ChronoField.SECOND_OF_MINUTE, 0);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof StrftimePattern)) {
            return false;
        }
        return format.equals(((StrftimePattern) o).format);
    }

    @Override
    public int hashCode() {
        return Objects.hash(format);
    }

    @Override
    public String toString() {
        return format;
    }
}
