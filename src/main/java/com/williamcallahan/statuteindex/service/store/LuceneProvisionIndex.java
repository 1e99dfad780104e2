package com.williamcallahan.statuteindex.service.store;

import com.williamcallahan.statuteindex.domain.legislation.DocumentStatus;
import com.williamcallahan.statuteindex.domain.legislation.ProvisionRecord;
import com.williamcallahan.statuteindex.domain.legislation.StoredDocument;
import com.williamcallahan.statuteindex.domain.legislation.StoredProvision;
import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.StringField;
import org.apache.lucene.document.TextField;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.index.StoredFields;
import org.apache.lucene.index.Term;
import org.apache.lucene.search.BooleanClause;
import org.apache.lucene.search.BooleanQuery;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.Query;
import org.apache.lucene.search.ScoreDoc;
import org.apache.lucene.search.SearcherManager;
import org.apache.lucene.search.TermQuery;
import org.apache.lucene.search.TopDocs;
import org.apache.lucene.store.ByteBuffersDirectory;

/**
 * Heap-resident Lucene index with one entry per provision.
 *
 * <p>Saving a document replaces all of its earlier entries and refreshes the searcher before
 * returning, so a search issued after {@link #replace} sees the new provisions.</p>
 */
final class LuceneProvisionIndex implements Closeable {

    static final String FIELD_TEXT = "text";
    private static final String FIELD_DOCUMENT_ID = "document_id";
    private static final String FIELD_STATUS = "status";
    private static final String FIELD_PROVISION_REF = "provision_ref";

    private final ByteBuffersDirectory directory = new ByteBuffersDirectory();
    private final IndexWriter writer;
    private final SearcherManager searcherManager;

    /**
     * Location of one matching provision with its relevance score.
     */
    record IndexHit(String documentId, String provisionRef, float score) {}

    LuceneProvisionIndex(Analyzer analyzer) {
        try {
            IndexWriterConfig config = new IndexWriterConfig(analyzer)
                    .setOpenMode(IndexWriterConfig.OpenMode.CREATE);
            this.writer = new IndexWriter(directory, config);
            this.searcherManager = new SearcherManager(writer, null);
        } catch (IOException openFailure) {
            throw new UncheckedIOException("Failed to open provision index", openFailure);
        }
    }

    void replace(StoredDocument document, List<StoredProvision> provisions) {
        List<Document> entries = new ArrayList<>(provisions.size());
        for (StoredProvision stored : provisions) {
            ProvisionRecord provision = stored.provision();
            Document entry = new Document();
            entry.add(new StringField(FIELD_DOCUMENT_ID, document.id(), Field.Store.YES));
            entry.add(new StringField(FIELD_STATUS, document.status().identifier(), Field.Store.NO));
            entry.add(new StringField(FIELD_PROVISION_REF, provision.provisionRef(), Field.Store.YES));
            String searchable = provision.heading().map(heading -> heading + " ").orElse("") + provision.content();
            entry.add(new TextField(FIELD_TEXT, searchable, Field.Store.NO));
            entries.add(entry);
        }
        try {
            writer.deleteDocuments(new Term(FIELD_DOCUMENT_ID, document.id()));
            if (!entries.isEmpty()) {
                writer.addDocuments(entries);
            }
            searcherManager.maybeRefreshBlocking();
        } catch (IOException indexFailure) {
            throw new UncheckedIOException("Failed to index " + document.id(), indexFailure);
        }
    }

    /**
     * Runs a text query, optionally restricted to one document or one status.
     *
     * @return hits by descending score, ties in indexing order
     */
    List<IndexHit> search(Query textQuery, String documentId, DocumentStatus status, int limit) {
        BooleanQuery.Builder query = new BooleanQuery.Builder().add(textQuery, BooleanClause.Occur.MUST);
        if (documentId != null) {
            query.add(new TermQuery(new Term(FIELD_DOCUMENT_ID, documentId)), BooleanClause.Occur.FILTER);
        }
        if (status != null) {
            query.add(new TermQuery(new Term(FIELD_STATUS, status.identifier())), BooleanClause.Occur.FILTER);
        }
        try {
            IndexSearcher searcher = searcherManager.acquire();
            try {
                TopDocs topDocs = searcher.search(query.build(), limit);
                StoredFields storedFields = searcher.storedFields();
                List<IndexHit> hits = new ArrayList<>(topDocs.scoreDocs.length);
                for (ScoreDoc scoreDoc : topDocs.scoreDocs) {
                    Document entry = storedFields.document(scoreDoc.doc);
                    hits.add(new IndexHit(entry.get(FIELD_DOCUMENT_ID), entry.get(FIELD_PROVISION_REF), scoreDoc.score));
                }
                return hits;
            } finally {
                searcherManager.release(searcher);
            }
        } catch (IOException searchFailure) {
            throw new UncheckedIOException("Provision search failed", searchFailure);
        }
    }

    @Override
    public void close() throws IOException {
        searcherManager.close();
        writer.close();
        directory.close();
    }
}
