package com.williamcallahan.statuteindex.web;

import com.williamcallahan.statuteindex.domain.legislation.CurrencyReport;
import java.util.List;

/**
 * JSON view of a currency check with the status as its wire identifier.
 */
public record CurrencyResponse(
        String documentId,
        String title,
        String type,
        String status,
        boolean current,
        Boolean provisionExists,
        List<String> warnings) {

    static CurrencyResponse from(CurrencyReport report) {
        return new CurrencyResponse(
                report.documentId(),
                report.title(),
                report.type(),
                report.status().identifier(),
                report.current(),
                report.provisionExists(),
                report.warnings());
    }
}
