package org.example.mystery.service.context;

import org.apache.lucene.analysis.standard.StandardAnalyzer;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.StoredField;
import org.apache.lucene.document.StringField;
import org.apache.lucene.document.TextField;
import org.apache.lucene.index.DirectoryReader;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.index.Term;
import org.apache.lucene.queryparser.classic.ParseException;
import org.apache.lucene.queryparser.classic.QueryParser;
import org.apache.lucene.search.BooleanClause;
import org.apache.lucene.search.BooleanQuery;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.Query;
import org.apache.lucene.search.ScoreDoc;
import org.apache.lucene.search.TermQuery;
import org.apache.lucene.store.ByteBuffersDirectory;
import org.apache.lucene.store.Directory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

/**
 * In-memory BM25 ranking of character background chunks.
 */
public class LuceneSimilarityBackend implements SimilarityBackend {

    private static final Logger log = LoggerFactory.getLogger(LuceneSimilarityBackend.class);

    private static final String FIELD_SOURCE = "sourceId";
    private static final String FIELD_CHUNK_ID = "chunkId";
    private static final String FIELD_CONTENT = "content";
    private static final String FIELD_START = "start";
    private static final String FIELD_END = "end";
    private static final String FIELD_SEQUENCE = "sequence";

    private final Directory index;
    private final StandardAnalyzer analyzer;

    public LuceneSimilarityBackend() {
        this.index = new ByteBuffersDirectory();
        this.analyzer = new StandardAnalyzer();
        // an initial empty commit lets readers open before anything is indexed
        try (IndexWriter writer = new IndexWriter(index, new IndexWriterConfig(analyzer))) {
            writer.commit();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to initialise in-memory similarity index", e);
        }
    }

    @Override
    public void index(String sourceId, List<TextChunk> chunks) throws IOException {
        try (IndexWriter writer = new IndexWriter(index, new IndexWriterConfig(analyzer))) {
            writer.deleteDocuments(new Term(FIELD_SOURCE, sourceId));
            for (TextChunk chunk : chunks) {
                Document doc = new Document();
                doc.add(new StringField(FIELD_SOURCE, sourceId, Field.Store.YES));
                doc.add(new StringField(FIELD_CHUNK_ID, chunk.id(), Field.Store.YES));
                doc.add(new TextField(FIELD_CONTENT, chunk.content(), Field.Store.YES));
                doc.add(new StoredField(FIELD_START, chunk.startOffset()));
                doc.add(new StoredField(FIELD_END, chunk.endOffset()));
                doc.add(new StoredField(FIELD_SEQUENCE, chunk.sequenceIndex()));
                writer.addDocument(doc);
            }
        }
        log.debug("Indexed {} chunks for source {}", chunks.size(), sourceId);
    }

    @Override
    public List<TextChunk> mostSimilar(String sourceId, String query, int limit) throws IOException {
        if (query == null || query.isBlank() || limit <= 0) {
            return List.of();
        }

        Query contentQuery;
        try {
            contentQuery = new QueryParser(FIELD_CONTENT, analyzer).parse(QueryParser.escape(query));
        } catch (ParseException e) {
            log.debug("Unparseable similarity query for {}: {}", sourceId, e.getMessage());
            return List.of();
        }

        Query finalQuery = new BooleanQuery.Builder()
                .add(contentQuery, BooleanClause.Occur.MUST)
                .add(new TermQuery(new Term(FIELD_SOURCE, sourceId)), BooleanClause.Occur.FILTER)
                .build();

        List<TextChunk> results = new ArrayList<>();
        try (DirectoryReader reader = DirectoryReader.open(index)) {
            IndexSearcher searcher = new IndexSearcher(reader);
            ScoreDoc[] hits = searcher.search(finalQuery, limit).scoreDocs;
            for (ScoreDoc hit : hits) {
                Document doc = searcher.storedFields().document(hit.doc);
                results.add(new TextChunk(
                        doc.get(FIELD_CONTENT),
                        doc.get(FIELD_CHUNK_ID),
                        doc.get(FIELD_SOURCE),
                        doc.getField(FIELD_START).numericValue().intValue(),
                        doc.getField(FIELD_END).numericValue().intValue(),
                        doc.getField(FIELD_SEQUENCE).numericValue().intValue()
                ));
            }
        }
        return results;
    }

    @Override
    public void remove(String sourceId) throws IOException {
        try (IndexWriter writer = new IndexWriter(index, new IndexWriterConfig(analyzer))) {
            writer.deleteDocuments(new Term(FIELD_SOURCE, sourceId));
        }
    }

    @Override
    public void clear() throws IOException {
        try (IndexWriter writer = new IndexWriter(index, new IndexWriterConfig(analyzer))) {
            writer.deleteAll();
        }
    }

    @Override
    public String getBackendName() {
        return "lucene-bm25";
    }
}
