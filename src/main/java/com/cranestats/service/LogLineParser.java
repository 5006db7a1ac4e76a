package com.cranestats.service;

import com.cranestats.exception.MalformedLineException;
import com.cranestats.model.TagMapping;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts statistic readings from controller log lines of the form
 * <pre>
 * 2025-06-01_10.15.30.123456: (42): TAG:[RMG04/RMG04:CRANE.STATISTIC.Perma.HoistCycles] 12345
 * </pre>
 *
 * A line is first checked against the precomputed search substrings; only candidates go
 * through the regular expressions. Instances are immutable and safe to share between threads.
 */
public class LogLineParser {

    static final DateTimeFormatter TIMESTAMP_FORMAT = new DateTimeFormatterBuilder()
        .appendPattern("yyyy-MM-dd_HH.mm.ss")
        .appendLiteral('.')
        .appendFraction(ChronoField.MICRO_OF_SECOND, 1, 6, false)
        .toFormatter();

    private static final Pattern LINE = Pattern.compile("^(.*?): \\(\\d+\\): (TAG:\\[[^\\]]+\\])\\s*(.*)$");
    private static final Pattern EQUIPMENT = Pattern.compile("^TAG:\\[([^/\\]]+)/");

    private final String staticPrefix;
    private final List<String> searchPatterns;

    /**
     * @param staticPrefix   descriptor text between "EQ:" and the tag detail, e.g. CRANE.STATISTIC.Perma
     * @param searchPatterns substrings a line must contain to be a candidate
     */
    public LogLineParser(String staticPrefix, Collection<String> searchPatterns) {
        this.staticPrefix = staticPrefix;
        this.searchPatterns = List.copyOf(searchPatterns);
    }

    /**
     * Cross product of equipment ids and tag ids, rendered as full tag descriptors.
     */
    public static LogLineParser forEquipment(List<String> equipmentIds, String statisticPrefix,
                                             String statisticType, List<String> tagIds) {
        String staticPrefix = statisticPrefix + "." + statisticType;
        List<String> patterns = new ArrayList<>(equipmentIds.size() * tagIds.size());
        for (String equipment : equipmentIds) {
            for (String tagId : tagIds) {
                patterns.add("TAG:[" + equipment + "/" + equipment + ":" + staticPrefix + "." + tagId + "]");
            }
        }
        return new LogLineParser(staticPrefix, patterns);
    }

    /**
     * Identifiers such as RMG01..RMG12 built from a prefix and a zero-padded number range.
     */
    public static List<String> equipmentRange(String prefix, int start, int end, int digits) {
        List<String> ids = new ArrayList<>();
        String format = "%s%0" + Math.max(digits, 1) + "d";
        for (int i = start; i <= end; i++) {
            ids.add(String.format(format, prefix, i));
        }
        return ids;
    }

    public boolean isCandidate(String line) {
        for (String pattern : searchPatterns) {
            if (line.contains(pattern)) {
                return true;
            }
        }
        return false;
    }

    public ParsedLine parse(String line) throws MalformedLineException {
        String trimmed = line.strip();
        Matcher matcher = LINE.matcher(trimmed);
        if (!matcher.matches()) {
            throw new MalformedLineException("BAD_LINE_STRUCTURE", "line does not match the tag line structure");
        }
        String timestampText = matcher.group(1);
        String descriptor = matcher.group(2);
        String payload = matcher.group(3).strip();

        Matcher equipmentMatcher = EQUIPMENT.matcher(descriptor);
        if (!equipmentMatcher.find()) {
            throw new MalformedLineException("BAD_EQUIPMENT", "could not extract equipment from " + descriptor);
        }
        String equipment = equipmentMatcher.group(1);

        // descriptor always ends with ']'
        String prefix = "TAG:[" + equipment + "/" + equipment + ":" + staticPrefix + ".";
        if (!descriptor.startsWith(prefix)) {
            throw new MalformedLineException("BAD_TAG_DETAIL", "could not extract tag detail from " + descriptor);
        }
        String tagDetail = TagMapping.clean(descriptor.substring(prefix.length(), descriptor.length() - 1));
        if (tagDetail.isEmpty()) {
            throw new MalformedLineException("BAD_TAG_DETAIL", "empty tag detail in " + descriptor);
        }

        return new ParsedLine(equipment, tagDetail, parseTimestamp(timestampText), payload);
    }

    static LocalDateTime parseTimestamp(String text) throws MalformedLineException {
        try {
            return LocalDateTime.parse(text.strip(), TIMESTAMP_FORMAT);
        } catch (DateTimeParseException e) {
            throw new MalformedLineException("BAD_TIMESTAMP", "could not parse timestamp '" + text + "'");
        }
    }

    public int patternCount() {
        return searchPatterns.size();
    }
}
