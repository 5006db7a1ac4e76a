package com.cranestats.service;

import com.cranestats.exception.MalformedLineException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LogLineParserTest {

    private static final String HOIST_LINE =
        "2025-06-01_10.15.30.123456: (42): TAG:[RMG04/RMG04:CRANE.STATISTIC.Perma.HoistCycles] 12345";

    private LogLineParser parser;

    @BeforeEach
    void setUp() {
        parser = LogLineParser.forEquipment(List.of("RMG04", "RMG07"), "CRANE.STATISTIC", "Perma",
            List.of("HoistCycles", "TwistlockCycles", "GantryDistance"));
    }

    @Test
    void testPatternsAreCrossProductOfEquipmentAndTags() {
        assertEquals(6, parser.patternCount());
    }

    @Test
    void testEquipmentRangeIsZeroPadded() {
        List<String> ids = LogLineParser.equipmentRange("RMG", 1, 12, 2);

        assertEquals(12, ids.size());
        assertEquals("RMG01", ids.get(0));
        assertEquals("RMG12", ids.get(11));
    }

    @Test
    void testCandidateFilter() {
        assertTrue(parser.isCandidate(HOIST_LINE));
        assertFalse(parser.isCandidate(HOIST_LINE.replace("RMG04", "RMG05")));
        assertFalse(parser.isCandidate("2025-06-01_10.15.30.123456: (42): heartbeat"));
    }

    @Test
    void testParseWellFormedLine() throws MalformedLineException {
        ParsedLine parsed = parser.parse(HOIST_LINE);

        assertEquals("RMG04", parsed.entityId());
        assertEquals("HoistCycles", parsed.tagDetail());
        assertEquals(LocalDateTime.of(2025, 6, 1, 10, 15, 30, 123_456_000), parsed.timestamp());
        assertEquals("12345", parsed.payload());
    }

    @Test
    void testShortFractionIsAccepted() throws MalformedLineException {
        ParsedLine parsed = parser.parse(
            "2025-06-01_10.15.30.5: (7): TAG:[RMG07/RMG07:CRANE.STATISTIC.Perma.TwistlockCycles] 88 cycles");

        assertEquals(500_000_000, parsed.timestamp().getNano());
        assertEquals("88 cycles", parsed.payload());
    }

    @Test
    void testNonPrintableCharactersAreStrippedFromTag() throws MalformedLineException {
        ParsedLine parsed = parser.parse(
            "2025-06-01_10.15.30.000001: (1): TAG:[RMG04/RMG04:CRANE.STATISTIC.Perma.Hoist\u0007Cycles\u00A0] 1");

        assertEquals("HoistCycles", parsed.tagDetail());
    }

    @Test
    void testBadTimestampIsRejected() {
        MalformedLineException ex = assertThrows(MalformedLineException.class, () -> parser.parse(
            "2025-13-45_99.99.99.000000: (42): TAG:[RMG04/RMG04:CRANE.STATISTIC.Perma.HoistCycles] 1"));

        assertEquals("BAD_TIMESTAMP", ex.getReason());
    }

    @Test
    void testMissingSequenceNumberIsRejected() {
        MalformedLineException ex = assertThrows(MalformedLineException.class, () -> parser.parse(
            "2025-06-01_10.15.30.123456 TAG:[RMG04/RMG04:CRANE.STATISTIC.Perma.HoistCycles] 1"));

        assertEquals("BAD_LINE_STRUCTURE", ex.getReason());
    }

    @Test
    void testForeignStatisticPrefixIsRejected() {
        MalformedLineException ex = assertThrows(MalformedLineException.class, () -> parser.parse(
            "2025-06-01_10.15.30.123456: (42): TAG:[RMG04/RMG04:CRANE.ALARM.Perma.HoistCycles] 1"));

        assertEquals("BAD_TAG_DETAIL", ex.getReason());
    }

    @Test
    void testMismatchedEquipmentInDescriptorIsRejected() {
        MalformedLineException ex = assertThrows(MalformedLineException.class, () -> parser.parse(
            "2025-06-01_10.15.30.123456: (42): TAG:[RMG04/RMG07:CRANE.STATISTIC.Perma.HoistCycles] 1"));

        assertEquals("BAD_TAG_DETAIL", ex.getReason());
    }

    @Test
    void testEmptyTagDetailIsRejected() {
        MalformedLineException ex = assertThrows(MalformedLineException.class, () -> parser.parse(
            "2025-06-01_10.15.30.123456: (42): TAG:[RMG04/RMG04:CRANE.STATISTIC.Perma.\u0003] 1"));

        assertEquals("BAD_TAG_DETAIL", ex.getReason());
    }
}
