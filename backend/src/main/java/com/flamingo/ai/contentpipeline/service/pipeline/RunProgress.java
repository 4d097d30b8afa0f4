package com.flamingo.ai.contentpipeline.service.pipeline;

import com.flamingo.ai.contentpipeline.domain.enums.Stage;
import com.flamingo.ai.contentpipeline.domain.model.CritiqueResult;
import java.time.Instant;

/** Immutable view of where a run is, published by the worker for status readers. */
public record RunProgress(Stage stage, CritiqueResult lastCritique, Instant updatedAt) {}
