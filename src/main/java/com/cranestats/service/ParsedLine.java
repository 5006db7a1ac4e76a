package com.cranestats.service;

import java.time.LocalDateTime;

/**
 * Fields recovered from one tag line.
 *
 * @param tagDetail tag detail with non-printable characters removed, not yet resolved
 * @param payload   result text after the tag descriptor
 */
public record ParsedLine(String entityId, String tagDetail, LocalDateTime timestamp, String payload) {
}
