package io.leavesfly.vshell.command.handlers;

import io.leavesfly.vshell.command.AbstractCommand;
import io.leavesfly.vshell.command.CommandContext;
import io.leavesfly.vshell.command.CommandHelp;
import io.leavesfly.vshell.exception.CommandParseException;
import io.leavesfly.vshell.shell.ShellResult;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.TextStyle;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;

/**
 * date - 显示日期时间
 * <p>
 * 支持 strftime 子集；-d 接受 ISO-8601、RFC-1123、@秒级时间戳。
 * 仅含日期的字符串按 UTC 零点解释，不带时区的日期时间按本地时区解释。
 */
public class DateCommand extends AbstractCommand {

    static final String DEFAULT_FORMAT = "%a %b %e %H:%M:%S %Z %Y";
    static final String ISO_FORMAT = "%Y-%m-%dT%H:%M:%S%z";

    private static final ZoneId UTC = ZoneId.of("UTC");
    private static final DateTimeFormatter LOCAL_WITH_SPACE = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm[:ss]");
    private static final DateTimeFormatter ZONE_NAME = DateTimeFormatter.ofPattern("zzz", Locale.US);

    private final Clock clock;

    public DateCommand(Clock clock) {
        super("date", CommandHelp.builder()
                .usage("date [OPTIONS] [+FORMAT]")
                .description("Display date and time")
                .addFlag("-u", "Display UTC time")
                .addFlag("-d DATE", "Display specified date instead of current time")
                .addFlag("-I", "Output in ISO 8601 format (same as +%Y-%m-%dT%H:%M:%S%z)")
                .addExample("date", "Show current date and time")
                .addExample("date +%Y-%m-%d", "Show date in YYYY-MM-DD format")
                .addExample("date +%Y%m%d", "Show date as YYYYMMDD")
                .addExample("date -u", "Show current UTC date and time")
                .addExample("date -d '2024-01-15'", "Show a specific date")
                .addExample("date +%s", "Show Unix timestamp")
                .build());
        this.clock = clock;
    }

    @Override
    public Mono<ShellResult> execute(List<String> args, CommandContext context) {
        boolean utc = false;
        boolean iso = false;
        String dateText = null;
        String format = null;

        for (int i = 0; i < args.size(); i++) {
            String arg = args.get(i);
            if ("-u".equals(arg) || "--utc".equals(arg)) {
                utc = true;
            } else if ("-I".equals(arg) || "--iso-8601".equals(arg)) {
                iso = true;
            } else if ("-d".equals(arg) || "--date".equals(arg)) {
                if (i + 1 >= args.size()) {
                    return Mono.just(ShellResult.error("date: option requires an argument -- d"));
                }
                dateText = args.get(++i);
            } else if (arg.startsWith("--date=")) {
                dateText = arg.substring("--date=".length());
            } else if (arg.startsWith("+")) {
                format = arg.substring(1);
            } else {
                return Mono.just(ShellResult.error("date: invalid option -- '" + arg + "'"));
            }
        }

        ZoneId zone = utc ? UTC : clock.getZone();
        Instant instant;
        try {
            instant = dateText != null ? parseDate(dateText, clock) : clock.instant();
        } catch (CommandParseException e) {
            return Mono.just(ShellResult.error(e.getMessage()));
        }

        String pattern = iso ? ISO_FORMAT : format != null ? format : DEFAULT_FORMAT;
        return Mono.just(ShellResult.ok(format(pattern, instant.atZone(zone), utc) + "\n"));
    }

    /**
     * 解析 -d 参数
     */
    static Instant parseDate(String text, Clock clock) {
        String value = text.trim();
        if ("now".equalsIgnoreCase(value) || value.isEmpty()) {
            return clock.instant();
        }
        if (value.startsWith("@")) {
            try {
                return Instant.ofEpochSecond(Long.parseLong(value.substring(1)));
            } catch (NumberFormatException e) {
                throw new CommandParseException("date: invalid date '" + text + "'", e);
            }
        }

        ZoneId localZone = clock.getZone();
        List<Function<String, Instant>> parsers = List.of(
                Instant::parse,
                v -> OffsetDateTime.parse(v).toInstant(),
                v -> LocalDate.parse(v).atStartOfDay(ZoneOffset.UTC).toInstant(),
                v -> LocalDateTime.parse(v).atZone(localZone).toInstant(),
                v -> LocalDateTime.parse(v, LOCAL_WITH_SPACE).atZone(localZone).toInstant(),
                v -> ZonedDateTime.parse(v, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant());

        DateTimeParseException lastError = null;
        for (Function<String, Instant> parser : parsers) {
            try {
                return parser.apply(value);
            } catch (DateTimeParseException e) {
                lastError = e;
            }
        }
        throw new CommandParseException("date: invalid date '" + text + "'", lastError);
    }

    /**
     * 按 strftime 格式输出，未知说明符原样保留
     */
    static String format(String pattern, ZonedDateTime time, boolean utc) {
        StringBuilder out = new StringBuilder();
        for (int i = 0; i < pattern.length(); i++) {
            char c = pattern.charAt(i);
            if (c != '%' || i + 1 >= pattern.length()) {
                out.append(c);
                continue;
            }
            char spec = pattern.charAt(++i);
            String value = specifier(spec, time, utc);
            out.append(value != null ? value : "%" + spec);
        }
        return out.toString();
    }

    private static String specifier(char spec, ZonedDateTime t, boolean utc) {
        int hour = t.getHour();
        int hour12 = hour % 12 == 0 ? 12 : hour % 12;
        switch (spec) {
            case 'Y':
                return String.valueOf(t.getYear());
            case 'y':
                return pad(t.getYear() % 100, 2);
            case 'm':
                return pad(t.getMonthValue(), 2);
            case 'd':
                return pad(t.getDayOfMonth(), 2);
            case 'e':
                return String.format("%2d", t.getDayOfMonth());
            case 'H':
                return pad(hour, 2);
            case 'M':
                return pad(t.getMinute(), 2);
            case 'S':
                return pad(t.getSecond(), 2);
            case 'I':
                return pad(hour12, 2);
            case 'p':
                return hour < 12 ? "AM" : "PM";
            case 'P':
                return hour < 12 ? "am" : "pm";
            case 'A':
                return t.getDayOfWeek().getDisplayName(TextStyle.FULL, Locale.US);
            case 'a':
                return t.getDayOfWeek().getDisplayName(TextStyle.SHORT, Locale.US);
            case 'B':
                return t.getMonth().getDisplayName(TextStyle.FULL, Locale.US);
            case 'b':
            case 'h':
                return t.getMonth().getDisplayName(TextStyle.SHORT, Locale.US);
            case 'u':
                return String.valueOf(t.getDayOfWeek().getValue());
            case 'w':
                return String.valueOf(t.getDayOfWeek().getValue() % 7);
            case 'j':
                return pad(t.getDayOfYear(), 3);
            case 'Z':
                return utc ? "UTC" : ZONE_NAME.format(t);
            case 'z':
                return utc ? "+0000" : offset(t.getOffset());
            case 's':
                return String.valueOf(t.toEpochSecond());
            case 'n':
                return "\n";
            case 't':
                return "\t";
            case '%':
                return "%";
            case 'F':
                return t.getYear() + "-" + pad(t.getMonthValue(), 2) + "-" + pad(t.getDayOfMonth(), 2);
            case 'T':
                return pad(hour, 2) + ":" + pad(t.getMinute(), 2) + ":" + pad(t.getSecond(), 2);
            case 'R':
                return pad(hour, 2) + ":" + pad(t.getMinute(), 2);
            case 'D':
                return pad(t.getMonthValue(), 2) + "/" + pad(t.getDayOfMonth(), 2) + "/" + pad(t.getYear() % 100, 2);
            case 'r':
                return pad(hour12, 2) + ":" + pad(t.getMinute(), 2) + ":" + pad(t.getSecond(), 2)
                        + " " + (hour < 12 ? "AM" : "PM");
            case 'c':
                return specifier('a', t, utc) + " " + specifier('b', t, utc) + " " + specifier('e', t, utc)
                        + " " + specifier('T', t, utc) + " " + t.getYear();
            default:
                return null;
        }
    }

    private static String offset(ZoneOffset offset) {
        int total = offset.getTotalSeconds() / 60;
        char sign = total >= 0 ? '+' : '-';
        int abs = Math.abs(total);
        return sign + pad(abs / 60, 2) + pad(abs % 60, 2);
    }

    private static String pad(int value, int width) {
        return String.format("%0" + width + "d", value);
    }
}
