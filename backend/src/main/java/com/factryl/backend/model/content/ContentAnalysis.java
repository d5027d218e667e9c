package com.factryl.backend.model.content;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Analyzer output attached upstream; read by the scorer, never written by the pipeline.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ContentAnalysis {
    private RelevanceAnalysis relevance;
    private CredibilityAnalysis credibility;
}
