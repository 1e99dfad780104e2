package com.williamcallahan.statuteindex.web;

import com.williamcallahan.statuteindex.domain.citation.ValidationResult;
import java.util.List;

/**
 * JSON view of a citation validation.
 */
public record CitationValidationResponse(
        CitationView citation,
        boolean documentExists,
        boolean provisionExists,
        String documentTitle,
        String status,
        List<String> warnings) {

    static CitationValidationResponse from(ValidationResult result) {
        return new CitationValidationResponse(
                CitationView.from(result.citation()),
                result.documentExists(),
                result.provisionExists(),
                result.documentTitle(),
                result.status(),
                result.warnings());
    }
}
