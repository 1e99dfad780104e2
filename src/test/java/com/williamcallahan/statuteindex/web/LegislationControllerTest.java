package com.williamcallahan.statuteindex.web;

import static org.hamcrest.Matchers.contains;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.BDDMockito.given;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.williamcallahan.statuteindex.domain.legislation.CurrencyReport;
import com.williamcallahan.statuteindex.domain.legislation.DocumentStatus;
import com.williamcallahan.statuteindex.domain.legislation.ProvisionRecord;
import com.williamcallahan.statuteindex.domain.legislation.StoredProvision;
import com.williamcallahan.statuteindex.domain.search.FtsQueryVariants;
import com.williamcallahan.statuteindex.domain.search.ProvisionSearchHit;
import com.williamcallahan.statuteindex.domain.search.SearchOutcome;
import com.williamcallahan.statuteindex.service.lookup.LegislationLookupService;
import com.williamcallahan.statuteindex.service.search.LegislationSearchService;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

/**
 * Verifies search, provision and currency endpoints.
 */
@WebMvcTest(controllers = LegislationController.class)
@Import(ExceptionResponseBuilder.class)
class LegislationControllerTest {

    @Autowired
    MockMvc mockMvc;

    @MockitoBean
    LegislationSearchService searchService;

    @MockitoBean
    LegislationLookupService lookupService;

    @Test
    void search_returnsRankedHitsWithExpression() throws Exception {
        given(searchService.search("data protection", null, "in_force", 5)).willReturn(new SearchOutcome(
                "data protection", "\"data\"* \"protection\"*", false, List.of(new ProvisionSearchHit(
                        "ukpga-2018-12", "Data Protection Act 2018", "s2", "2", null, "Data protection principles.", 2))));

        mockMvc.perform(get("/api/legislation/search")
                        .param("query", "data protection")
                        .param("status", "in_force")
                        .param("limit", "5"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.expression").value("\"data\"* \"protection\"*"))
                .andExpect(jsonPath("$.usedFallback").value(false))
                .andExpect(jsonPath("$.results[0].provisionRef").value("s2"))
                .andExpect(jsonPath("$.results[0].documentTitle").value("Data Protection Act 2018"));
    }

    @Test
    void search_unknownStatusIsBadRequest() throws Exception {
        given(searchService.search(anyString(), isNull(), anyString(), isNull()))
                .willThrow(new IllegalArgumentException("Unknown document status: revoked"));

        mockMvc.perform(get("/api/legislation/search").param("query", "data").param("status", "revoked"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Unknown document status: revoked"));
    }

    @Test
    void queryVariants_exposesBothExpressions() throws Exception {
        given(searchService.queryVariants("data protection"))
                .willReturn(new FtsQueryVariants("\"data\"* \"protection\"*", "data* OR protection*"));

        mockMvc.perform(get("/api/legislation/query-variants").param("query", "data protection"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.primary").value("\"data\"* \"protection\"*"))
                .andExpect(jsonPath("$.fallback").value("data* OR protection*"));
    }

    @Test
    void provision_returnsFlatProvisionViews() throws Exception {
        given(lookupService.getProvision("ukpga-2018-12", "3", null)).willReturn(List.of(new StoredProvision(
                "ukpga-2018-12", new ProvisionRecord("s3", "3", "Terms", "Terms text."))));

        mockMvc.perform(get("/api/legislation/provision").param("documentId", "ukpga-2018-12").param("section", "3"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].documentId").value("ukpga-2018-12"))
                .andExpect(jsonPath("$[0].provisionRef").value("s3"))
                .andExpect(jsonPath("$[0].content").value("Terms text."));
    }

    @Test
    void provision_missingIsNotFound() throws Exception {
        given(lookupService.getProvision(anyString(), any(), any())).willReturn(List.of());

        mockMvc.perform(get("/api/legislation/provision").param("documentId", "Finance Act 2021"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.status").value("error"));
    }

    @Test
    void currency_reportsStatusIdentifierAndWarnings() throws Exception {
        given(lookupService.checkCurrency("ukpga-1998-29", null)).willReturn(Optional.of(new CurrencyReport(
                "ukpga-1998-29", "Data Protection Act 1998", "statute", DocumentStatus.REPEALED, false, null,
                List.of("This statute has been repealed"))));

        mockMvc.perform(get("/api/legislation/currency").param("documentId", "ukpga-1998-29"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("repealed"))
                .andExpect(jsonPath("$.current").value(false))
                .andExpect(jsonPath("$.warnings", contains("This statute has been repealed")));
    }

    @Test
    void currency_unknownDocumentIsNotFound() throws Exception {
        given(lookupService.checkCurrency(anyString(), any())).willReturn(Optional.empty());

        mockMvc.perform(get("/api/legislation/currency").param("documentId", "unknown"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Document not found: unknown"));
    }
}
