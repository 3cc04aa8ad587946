package com.goormthonuniv.credibility.stats;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.Date;

/**
 * 여러 형태의 타임스탬프를 {@link Instant}로 정규화.
 * 날짜만 있는 값(LocalDate, "2026-01-01")은 UTC 자정으로 본다.
 * 문자열은 'T' 또는 공백 구분자, 오프셋은 Z / +09:00 / +0900 / 생략(UTC)을 받는다.
 */
public final class Timestamps {

    // 오프셋은 선택: 있으면 OffsetDateTime, 없으면 LocalDateTime 으로 파싱
    private static final DateTimeFormatter DATE_TIME = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE_TIME)
            .optionalStart().appendOffset("+HH:MM", "Z").optionalEnd()
            .optionalStart().appendOffset("+HHMM", "Z").optionalEnd()
            .toFormatter();

    private Timestamps() {}

    public static Instant toInstant(Object value) {
        if (value == null) throw new IllegalArgumentException("timestamp is null");

        if (value instanceof Instant i) return i;
        if (value instanceof OffsetDateTime odt) return odt.toInstant();
        if (value instanceof ZonedDateTime zdt) return zdt.toInstant();
        if (value instanceof LocalDateTime ldt) return ldt.toInstant(ZoneOffset.UTC);
        if (value instanceof LocalDate ld) return ld.atStartOfDay(ZoneOffset.UTC).toInstant();
        // java.sql.Timestamp 포함
        if (value instanceof Date d) return d.toInstant();
        if (value instanceof Number n) return Instant.ofEpochMilli(n.longValue());
        if (value instanceof CharSequence cs) return parse(cs.toString().trim());

        throw new IllegalArgumentException("unsupported timestamp type: " + value.getClass().getName());
    }

    private static Instant parse(String raw) {
        if (raw.isEmpty()) throw new IllegalArgumentException("timestamp is blank");
        try {
            if (raw.length() == 10) {
                return LocalDate.parse(raw).atStartOfDay(ZoneOffset.UTC).toInstant();
            }
            // "2026-01-01 10:00:00" (SQL 형식)
            String normalized = raw.length() > 10 && raw.charAt(10) == ' '
                    ? raw.substring(0, 10) + 'T' + raw.substring(11)
                    : raw;
            TemporalAccessor parsed = DATE_TIME.parseBest(normalized, OffsetDateTime::from, LocalDateTime::from);
            if (parsed instanceof OffsetDateTime odt) return odt.toInstant();
            return ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("unparseable timestamp: " + raw, e);
        }
    }
}
