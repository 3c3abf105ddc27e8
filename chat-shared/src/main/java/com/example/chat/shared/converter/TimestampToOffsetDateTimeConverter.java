package com.example.chat.shared.converter;

import org.springframework.core.convert.converter.Converter;
import org.springframework.data.convert.ReadingConverter;

import java.sql.Timestamp;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

/**
 * Reads driver-level timestamp values into UTC {@link OffsetDateTime} properties.
 * Columns declared without a time zone come back as {@link Timestamp} or {@link LocalDateTime}
 * depending on the driver.
 */
@ReadingConverter
public class TimestampToOffsetDateTimeConverter implements Converter<Timestamp, OffsetDateTime> {

    @Override
    public OffsetDateTime convert(Timestamp source) {
        return source.toInstant().atOffset(ZoneOffset.UTC);
    }

    @ReadingConverter
    public static class FromLocalDateTime implements Converter<LocalDateTime, OffsetDateTime> {

        @Override
        public OffsetDateTime convert(LocalDateTime source) {
            return source.atOffset(ZoneOffset.UTC);
        }
    }
}
