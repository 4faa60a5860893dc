package com.tazifor.popup.capping;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.time.temporal.IsoFields;
import java.time.temporal.TemporalAdjusters;

/**
 * Calendar counting windows, all in UTC.
 *
 * A window id names the window an instant falls in. A counter is live only
 * while the current window id equals the id it was recorded under.
 */
public enum CapWindow {

    HOUR {
        @Override
        public String idOf(Instant now) {
            return HOUR_ID.format(now);
        }

        @Override
        public Instant endOf(Instant now) {
            return now.truncatedTo(ChronoUnit.HOURS).plus(1, ChronoUnit.HOURS);
        }
    },

    DAY {
        @Override
        public String idOf(Instant now) {
            return utcDate(now).toString();
        }

        @Override
        public Instant endOf(Instant now) {
            return startOf(utcDate(now).plusDays(1));
        }
    },

    /** ISO week, Monday to Sunday. */
    WEEK {
        @Override
        public String idOf(Instant now) {
            LocalDate date = utcDate(now);
            return String.format("%d-W%02d",
                date.get(IsoFields.WEEK_BASED_YEAR), date.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR));
        }

        @Override
        public Instant endOf(Instant now) {
            return startOf(utcDate(now).with(TemporalAdjusters.next(DayOfWeek.MONDAY)));
        }
    },

    MONTH {
        @Override
        public String idOf(Instant now) {
            LocalDate date = utcDate(now);
            return String.format("%d-%02d", date.getYear(), date.getMonthValue());
        }

        @Override
        public Instant endOf(Instant now) {
            return startOf(utcDate(now).with(TemporalAdjusters.firstDayOfNextMonth()));
        }
    };

    private static final DateTimeFormatter HOUR_ID = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH")
        .withZone(ZoneOffset.UTC);

    public abstract String idOf(Instant now);

    /**
     * First instant after the window containing {@code now}.
     */
    public abstract Instant endOf(Instant now);

    static LocalDate utcDate(Instant now) {
        return LocalDate.ofInstant(now, ZoneOffset.UTC);
    }

    private static Instant startOf(LocalDate date) {
        return ZonedDateTime.of(date.atStartOfDay(), ZoneOffset.UTC).toInstant();
    }
}
