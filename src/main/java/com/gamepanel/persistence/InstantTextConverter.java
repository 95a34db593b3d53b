package com.gamepanel.persistence;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * SQLite has no timestamp type; instants are stored as UTC TEXT in a fixed-width, lexically sortable format so
 * {@code ORDER BY} on the column stays chronological.
 *
 * <p>Besides its own format, reading accepts SQLite's {@code datetime('now')} text (no fraction) and ISO-8601
 * instants, for rows edited by hand.</p>
 */
@Converter(autoApply = true)
public class InstantTextConverter implements AttributeConverter<Instant, String> {

    private static final DateTimeFormatter TEXT_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss[.SSS]");

    @Override
    public String convertToDatabaseColumn(Instant attribute) {
        if (attribute == null) return null;
        // the optional section is printed, so writes always carry millis
        return LocalDateTime.ofInstant(attribute, ZoneOffset.UTC).format(TEXT_FORMAT);
    }

    @Override
    public Instant convertToEntityAttribute(String dbData) {
        if (dbData == null || dbData.isBlank()) return null;
        String text = dbData.trim();

        try {
            return text.indexOf('T') > 0
                    ? Instant.parse(text)
                    : LocalDateTime.parse(text, TEXT_FORMAT).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Unsupported timestamp value for Instant: '" + dbData + "'", e);
        }
    }
}
