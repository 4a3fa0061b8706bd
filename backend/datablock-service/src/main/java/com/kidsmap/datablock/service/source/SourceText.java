package com.kidsmap.datablock.service.source;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 소스 응답 문자열 정리 유틸리티
 */
final class SourceText {

    private static final Pattern HTML_TAG = Pattern.compile("<[^>]*>");
    private static final Pattern HREF = Pattern.compile("href=\"([^\"]+)\"");
    private static final DateTimeFormatter BASIC_DATE = DateTimeFormatter.BASIC_ISO_DATE;

    private SourceText() {
    }

    static String stripHtml(String html) {
        if (html == null || html.isBlank()) return null;
        String text = HTML_TAG.matcher(html).replaceAll("")
                .replace("&quot;", "\"")
                .replace("&#39;", "'")
                .replace("&lt;", "<")
                .replace("&gt;", ">")
                .replace("&nbsp;", " ")
                .replace("&amp;", "&")
                .trim();
        return text.isEmpty() ? null : text;
    }

    /**
     * TourAPI homepage 필드는 a 태그로 감싸져 오는 경우가 많다
     */
    static String extractUrl(String html) {
        if (html == null || html.isBlank()) return null;
        Matcher matcher = HREF.matcher(html);
        return matcher.find() ? matcher.group(1) : stripHtml(html);
    }

    static Double parseDouble(String value) {
        if (value == null || value.isBlank()) return null;
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    static Long parseLong(String value) {
        if (value == null || value.isBlank()) return null;
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * ISO-8601 (YouTube publishedAt)
     */
    static LocalDateTime parseIsoDateTime(String value) {
        if (value == null || value.isBlank()) return null;
        try {
            return OffsetDateTime.parse(value).toLocalDateTime();
        } catch (DateTimeParseException e) {
            try {
                return LocalDateTime.parse(value);
            } catch (DateTimeParseException ignored) {
                return null;
            }
        }
    }

    /**
     * yyyyMMdd (네이버 postdate)
     */
    static LocalDateTime parseBasicDate(String value) {
        if (value == null || value.length() < 8) return null;
        try {
            return LocalDate.parse(value.substring(0, 8), BASIC_DATE).atStartOfDay();
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    static String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (value.isMissingNode() || value.isNull()) return null;
        String text = value.asText();
        return text == null || text.isBlank() ? null : text.trim();
    }
}
