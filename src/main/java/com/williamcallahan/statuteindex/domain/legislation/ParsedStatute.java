package com.williamcallahan.statuteindex.domain.legislation;

import java.util.List;
import java.util.Objects;

/**
 * Seed representation of one statute: document metadata plus its provisions in document order.
 *
 * @param id store identifier, for example {@code ukpga-2018-12}
 * @param type document type (always {@code statute} for this collection)
 * @param title document title
 * @param shortName abbreviated citation name, for example {@code DPA 2018}; empty when unknown
 * @param status lifecycle status identifier
 * @param issuedDate ISO issue date
 * @param url canonical document URL
 * @param provisions extracted provisions
 */
public record ParsedStatute(
        String id,
        String type,
        String title,
        String shortName,
        String status,
        String issuedDate,
        String url,
        List<ProvisionRecord> provisions) {

    public static final String TYPE_STATUTE = "statute";

    public ParsedStatute {
        Objects.requireNonNull(id, "Statute id is required");
        Objects.requireNonNull(title, "Statute title is required");
        type = type == null ? TYPE_STATUTE : type;
        shortName = shortName == null ? "" : shortName;
        status = status == null ? DocumentStatus.IN_FORCE.identifier() : status;
        issuedDate = issuedDate == null ? "" : issuedDate;
        url = url == null ? "" : url;
        provisions = provisions == null ? List.of() : List.copyOf(provisions);
    }

    /**
     * Builds a placeholder seed for a document whose markup is not published, so it is not fetched again.
     */
    public static ParsedStatute placeholder(DocumentStub stub) {
        return new ParsedStatute(
                stub.documentId(),
                TYPE_STATUTE,
                stub.title(),
                "",
                DocumentStatus.IN_FORCE.identifier(),
                stub.year() + "-01-01",
                stub.url(),
                List.of());
    }
}
