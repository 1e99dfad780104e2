package com.williamcallahan.statuteindex.service.store;

import com.williamcallahan.statuteindex.domain.legislation.DocumentStatus;
import com.williamcallahan.statuteindex.domain.legislation.ParsedStatute;
import com.williamcallahan.statuteindex.domain.legislation.ProvisionRecord;
import com.williamcallahan.statuteindex.domain.legislation.StoredDocument;
import com.williamcallahan.statuteindex.domain.legislation.StoredProvision;
import com.williamcallahan.statuteindex.domain.search.ProvisionSearchHit;
import java.io.Closeable;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.standard.StandardAnalyzer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Provision store held in memory, used when no database is configured and in tests.
 *
 * <p>Each save swaps in an immutable snapshot of the document, so readers never observe a
 * half-written provision list. Full-text search runs against a heap-resident Lucene index of the
 * same provisions, analyzed with {@link StandardAnalyzer}.</p>
 */
public class InMemoryProvisionStore implements ProvisionStore, Closeable {
    private static final Logger logger = LoggerFactory.getLogger(InMemoryProvisionStore.class);

    private static final int SNIPPET_LENGTH = 240;

    private final ConcurrentHashMap<String, DocumentSnapshot> documents = new ConcurrentHashMap<>();
    private final CopyOnWriteArrayList<String> insertionOrder = new CopyOnWriteArrayList<>();
    private final Analyzer analyzer = new StandardAnalyzer();
    private final LuceneProvisionIndex index = new LuceneProvisionIndex(analyzer);

    @Override
    public void save(ParsedStatute statute) {
        Objects.requireNonNull(statute, "statute");
        StoredDocument document = StoredDocument.fromStatute(statute);
        Map<String, StoredProvision> byReference = new LinkedHashMap<>();
        for (ProvisionRecord provision : statute.provisions()) {
            StoredProvision previous =
                    byReference.putIfAbsent(provision.provisionRef(), new StoredProvision(document.id(), provision));
            if (previous != null) {
                logger.warn("Ignoring duplicate provision {} in {}", provision.provisionRef(), document.id());
            }
        }
        List<StoredProvision> provisions = List.copyOf(byReference.values());
        synchronized (index) {
            index.replace(document, provisions);
            documents.put(document.id(), new DocumentSnapshot(document, provisions, byReference));
        }
        insertionOrder.addIfAbsent(document.id());
        logger.debug("Stored {} with {} provisions", document.id(), byReference.size());
    }

    @Override
    public Optional<StoredDocument> findDocument(String documentId) {
        if (documentId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(documents.get(documentId)).map(DocumentSnapshot::document);
    }

    @Override
    public List<StoredDocument> documents() {
        List<StoredDocument> ordered = new ArrayList<>();
        for (String documentId : insertionOrder) {
            DocumentSnapshot snapshot = documents.get(documentId);
            if (snapshot != null) {
                ordered.add(snapshot.document());
            }
        }
        return ordered;
    }

    @Override
    public Optional<StoredProvision> findProvision(String documentId, String provisionRef) {
        if (documentId == null || provisionRef == null) {
            return Optional.empty();
        }
        DocumentSnapshot snapshot = documents.get(documentId);
        return snapshot == null ? Optional.empty() : Optional.ofNullable(snapshot.byReference().get(provisionRef));
    }

    @Override
    public List<StoredProvision> provisions(String documentId) {
        DocumentSnapshot snapshot = documentId == null ? null : documents.get(documentId);
        return snapshot == null ? List.of() : snapshot.provisions();
    }

    @Override
    public List<ProvisionSearchHit> search(String expression, String documentId, DocumentStatus status, int limit) {
        FtsExpression parsed = FtsExpression.parse(expression, analyzer);
        if (parsed.isEmpty() || limit <= 0) {
            return List.of();
        }
        List<ProvisionSearchHit> hits = new ArrayList<>();
        for (LuceneProvisionIndex.IndexHit indexHit :
                index.search(parsed.toQuery(LuceneProvisionIndex.FIELD_TEXT), documentId, status, limit)) {
            DocumentSnapshot snapshot = documents.get(indexHit.documentId());
            StoredProvision stored = snapshot == null ? null : snapshot.byReference().get(indexHit.provisionRef());
            if (stored == null) {
                continue;
            }
            ProvisionRecord provision = stored.provision();
            hits.add(new ProvisionSearchHit(
                    indexHit.documentId(),
                    snapshot.document().title(),
                    provision.provisionRef(),
                    provision.section(),
                    provision.title(),
                    snippet(provision.content()),
                    indexHit.score()));
        }
        return List.copyOf(hits);
    }

    @Override
    public int documentCount() {
        return documents.size();
    }

    @Override
    public void close() throws IOException {
        index.close();
        analyzer.close();
    }

    private static String snippet(String content) {
        if (content.length() <= SNIPPET_LENGTH) {
            return content;
        }
        int cut = content.lastIndexOf(' ', SNIPPET_LENGTH);
        return content.substring(0, cut > 0 ? cut : SNIPPET_LENGTH) + "...";
    }

    private record DocumentSnapshot(
            StoredDocument document, List<StoredProvision> provisions, Map<String, StoredProvision> byReference) {}
}
