package com.phillippitts.draftsmith.domain.session;

public record DraftSection(String id, String outlineRefId, String content, int wordCount) {
}
