package com.flamingo.ai.contentpipeline.domain.model;

import com.flamingo.ai.contentpipeline.domain.enums.IssueKind;

/** A problem flagged in a draft, e.g. {@code UNGROUNDED_CLAIM at section:Setup}. */
public record CritiqueIssue(IssueKind kind, String location, String detail) {}
