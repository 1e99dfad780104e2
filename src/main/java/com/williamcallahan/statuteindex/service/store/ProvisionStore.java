package com.williamcallahan.statuteindex.service.store;

import com.williamcallahan.statuteindex.domain.legislation.DocumentStatus;
import com.williamcallahan.statuteindex.domain.legislation.ParsedStatute;
import com.williamcallahan.statuteindex.domain.legislation.StoredDocument;
import com.williamcallahan.statuteindex.domain.legislation.StoredProvision;
import com.williamcallahan.statuteindex.domain.search.ProvisionSearchHit;
import java.util.List;
import java.util.Optional;

/**
 * Persistent home of documents and their provisions, keyed by (document id, provision reference).
 *
 * <p>Implementations must be safe for concurrent readers while a writer replaces documents.</p>
 */
public interface ProvisionStore {

    /**
     * Stores a statute and its provisions, replacing any previous version of the same document.
     */
    void save(ParsedStatute statute);

    Optional<StoredDocument> findDocument(String documentId);

    /**
     * Lists stored documents in the order they were first saved.
     */
    List<StoredDocument> documents();

    Optional<StoredProvision> findProvision(String documentId, String provisionRef);

    /**
     * Lists a document's provisions in document order; empty for unknown documents.
     */
    List<StoredProvision> provisions(String documentId);

    /**
     * Evaluates a full-text expression over provision text.
     *
     * @param expression expression in the normalizer's syntax
     * @param documentId restricts matches to one document when not null
     * @param status restricts matches to documents with this status when not null
     * @param limit maximum hits returned
     * @return hits in rank order
     */
    List<ProvisionSearchHit> search(String expression, String documentId, DocumentStatus status, int limit);

    int documentCount();
}
