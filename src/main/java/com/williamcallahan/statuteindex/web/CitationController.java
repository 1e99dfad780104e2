package com.williamcallahan.statuteindex.web;

import com.williamcallahan.statuteindex.service.lookup.LegislationLookupService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Citation tools: parse free text into structure, check it against the store, render it.
 */
@RestController
@RequestMapping("/api/citations")
public class CitationController extends BaseController {

    private final LegislationLookupService lookupService;

    public CitationController(LegislationLookupService lookupService, ExceptionResponseBuilder exceptionBuilder) {
        super(exceptionBuilder);
        this.lookupService = lookupService;
    }

    @PostMapping("/parse")
    public ResponseEntity<CitationView> parse(@RequestBody CitationRequest request) {
        return ResponseEntity.ok(CitationView.from(lookupService.parseCitation(request.citation())));
    }

    @PostMapping("/validate")
    public ResponseEntity<CitationValidationResponse> validate(@RequestBody CitationRequest request) {
        return ResponseEntity.ok(CitationValidationResponse.from(lookupService.validateCitation(request.citation())));
    }

    /**
     * Renders a citation; an unknown format is answered with 400.
     */
    @PostMapping("/format")
    public ResponseEntity<CitationFormatResponse> format(@RequestBody CitationRequest request) {
        return ResponseEntity.ok(
                CitationFormatResponse.from(lookupService.formatCitation(request.citation(), request.format())));
    }
}
