package com.phillippitts.draftsmith.service.provider;

public record TokenUsage(int promptTokens, int completionTokens, int totalTokens) {
}
