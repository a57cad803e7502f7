package com.chicu.botjobs.engine;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Правило сдвига даты для повторяющихся напоминаний.
 *
 * Формат: один или несколько термов "&lt;n&gt;&lt;unit&gt;" через пробел,
 * unit = s | m | h | d | w | mo | y. Например "1d", "2h 30m", "1mo".
 * Сутки, месяцы и годы считаются по календарю в поясе задачи.
 */
public final class RecurrenceRule {

    private static final Pattern TERM = Pattern.compile("(\\d+)(mo|[smhdwy])");

    private static final Map<String, ChronoUnit> UNITS = Map.of(
            "s", ChronoUnit.SECONDS,
            "m", ChronoUnit.MINUTES,
            "h", ChronoUnit.HOURS,
            "d", ChronoUnit.DAYS,
            "w", ChronoUnit.WEEKS,
            "mo", ChronoUnit.MONTHS,
            "y", ChronoUnit.YEARS
    );

    private record Term(long amount, ChronoUnit unit) {}

    private final String source;
    private final List<Term> terms;

    private RecurrenceRule(String source, List<Term> terms) {
        this.source = source;
        this.terms = terms;
    }

    /**
     * @throws IllegalArgumentException если правило пустое, не разбирается
     *                                  или не двигает время вперёд
     */
    public static RecurrenceRule parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Recurrence rule is empty");
        }

        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        List<Term> terms = new ArrayList<>();

        for (String token : normalized.split("\\s+")) {
            Matcher m = TERM.matcher(token);
            if (!m.matches()) {
                throw new IllegalArgumentException("Bad recurrence term '" + token + "' in rule '" + raw + "'");
            }
            long amount;
            try {
                amount = Long.parseLong(m.group(1));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Recurrence amount too large in rule '" + raw + "'", e);
            }
            if (amount <= 0) {
                throw new IllegalArgumentException("Recurrence rule must advance time: '" + raw + "'");
            }
            terms.add(new Term(amount, UNITS.get(m.group(2))));
        }

        return new RecurrenceRule(normalized, List.copyOf(terms));
    }

    /**
     * Один шаг от at. Шаги "mo"/"y" считаются от предыдущего результата, а не от исходной даты:
     * 31.01 +1mo = 29.02, ещё +1mo = 29.03 (день, обрезанный в коротком месяце, не восстанавливается).
     */
    public ZonedDateTime applyTo(ZonedDateTime at) {
        ZonedDateTime next = at;
        for (Term t : terms) {
            next = next.plus(t.amount(), t.unit());
        }
        return next;
    }

    /**
     * Следующий момент после at. Всегда строго позже at.
     */
    public Instant applyTo(Instant at, ZoneId zone) {
        Instant next = applyTo(at.atZone(zone)).toInstant();
        if (!next.isAfter(at)) {
            throw new IllegalStateException("Rule '" + source + "' did not advance " + at);
        }
        return next;
    }

    public String asText() {
        return source;
    }

    @Override
    public String toString() {
        return "RecurrenceRule[" + source + "]";
    }
}
