package hle.affinity.config;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Map;

/**
 * Parses duration strings written as a sequence of decimal numbers with unit suffixes,
 * such as {@code "300ms"}, {@code "1.5h"} or {@code "2h45m"}.
 *
 * <p>Valid units are {@code ns}, {@code us} (or {@code µs}), {@code ms}, {@code s},
 * {@code m} and {@code h}. A leading sign is allowed; {@code "0"} needs no unit.
 */
public final class Durations {

    private static final Map<String, Long> UNIT_NANOS = Map.of(
            "ns", 1L,
            "us", 1_000L,
            "µs", 1_000L,
            "μs", 1_000L,
            "ms", 1_000_000L,
            "s", 1_000_000_000L,
            "m", 60_000_000_000L,
            "h", 3_600_000_000_000L);

    private Durations() {
    }

    /**
     * Parses a duration string.
     *
     * @throws IllegalArgumentException if the text is not a valid duration or overflows
     */
    public static Duration parse(String text) {
        if (text == null || text.isEmpty()) {
            throw new IllegalArgumentException("invalid duration \"\"");
        }
        String s = text;
        boolean negative = false;
        if (s.charAt(0) == '-' || s.charAt(0) == '+') {
            negative = s.charAt(0) == '-';
            s = s.substring(1);
        }
        if ("0".equals(s)) {
            return Duration.ZERO;
        }
        if (s.isEmpty()) {
            throw invalid(text);
        }

        BigDecimal totalNanos = BigDecimal.ZERO;
        int i = 0;
        while (i < s.length()) {
            int numberStart = i;
            while (i < s.length() && (Character.isDigit(s.charAt(i)) || s.charAt(i) == '.')) {
                i++;
            }
            String number = s.substring(numberStart, i);
            if (number.isEmpty() || ".".equals(number)) {
                throw invalid(text);
            }

            int unitStart = i;
            while (i < s.length() && !Character.isDigit(s.charAt(i)) && s.charAt(i) != '.') {
                i++;
            }
            String unit = s.substring(unitStart, i);
            if (unit.isEmpty()) {
                throw new IllegalArgumentException("missing unit in duration \"" + text + "\"");
            }
            Long nanosPerUnit = UNIT_NANOS.get(unit);
            if (nanosPerUnit == null) {
                throw new IllegalArgumentException("unknown unit \"" + unit + "\" in duration \"" + text + "\"");
            }

            BigDecimal value;
            try {
                value = new BigDecimal(number);
            } catch (NumberFormatException e) {
                throw invalid(text);
            }
            totalNanos = totalNanos.add(value.multiply(BigDecimal.valueOf(nanosPerUnit)));
        }

        if (totalNanos.compareTo(BigDecimal.valueOf(Long.MAX_VALUE)) > 0) {
            throw invalid(text);
        }
        // fractions below one nanosecond are dropped
        long nanos = totalNanos.longValue();
        return Duration.ofNanos(negative ? -nanos : nanos);
    }

    /**
     * Formats a duration in the form accepted by {@link #parse(String)}, e.g. {@code 1h2m3.5s}.
     */
    public static String format(Duration duration) {
        if (duration.isZero()) {
            return "0s";
        }
        StringBuilder out = new StringBuilder();
        if (duration.isNegative()) {
            out.append('-');
            duration = duration.negated();
        }
        long hours = duration.toHours();
        int minutes = duration.toMinutesPart();
        int seconds = duration.toSecondsPart();
        int nanos = duration.toNanosPart();
        if (hours > 0) {
            out.append(hours).append('h');
        }
        if (minutes > 0) {
            out.append(minutes).append('m');
        }
        if (seconds > 0 || nanos > 0) {
            if (nanos == 0) {
                out.append(seconds).append('s');
            } else if (seconds == 0 && nanos % 1_000_000 == 0) {
                out.append(nanos / 1_000_000).append("ms");
            } else {
                BigDecimal fraction = BigDecimal.valueOf(seconds).add(BigDecimal.valueOf(nanos, 9));
                out.append(fraction.stripTrailingZeros().toPlainString()).append('s');
            }
        }
        return out.toString();
    }

    private static IllegalArgumentException invalid(String text) {
        return new IllegalArgumentException("invalid duration \"" + text + "\"");
    }
}
