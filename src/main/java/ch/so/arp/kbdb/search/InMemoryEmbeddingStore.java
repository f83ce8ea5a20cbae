package ch.so.arp.kbdb.search;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Heap based replacement for the PostgreSQL store, used for local development
 * and tests. It keeps the relational rules of the schema: chunks need an
 * existing document and a unique index within it, there is at most one
 * embedding per chunk, model and task, and removing a document removes its
 * chunks and their embeddings. Distances are computed with
 * {@link DistanceMetric#distance(float[], float[])}, which mirrors the pgvector
 * operators.
 */
class InMemoryEmbeddingStore implements EmbeddingStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryEmbeddingStore.class);

    private final int dimensions;
    private final AtomicLong documentIds = new AtomicLong();
    private final AtomicLong chunkIds = new AtomicLong();
    private final Map<Long, Document> documents = new LinkedHashMap<>();
    private final Map<Long, DocumentChunk> chunks = new LinkedHashMap<>();
    private final Map<EmbeddingKey, ChunkEmbedding> embeddings = new HashMap<>();

    InMemoryEmbeddingStore(int dimensions) {
        if (dimensions <= 0) {
            throw new IllegalArgumentException("dimensions must be positive");
        }
        this.dimensions = dimensions;
    }

    synchronized Document addDocument(String name, String content) {
        Document document = new Document(documentIds.incrementAndGet(), Objects.requireNonNull(name, "name"),
                Objects.requireNonNull(content, "content"));
        documents.put(document.id(), document);
        return document;
    }

    synchronized DocumentChunk addChunk(long documentId, int index, String content) {
        if (!documents.containsKey(documentId)) {
            throw new DocumentStoreException("Document " + documentId + " does not exist");
        }
        boolean taken = chunks.values().stream()
                .anyMatch(chunk -> chunk.documentId() == documentId && chunk.index() == index);
        if (taken) {
            throw new DocumentStoreException("Document " + documentId + " already has a chunk with index " + index);
        }
        DocumentChunk chunk = new DocumentChunk(chunkIds.incrementAndGet(), documentId, index,
                Objects.requireNonNull(content, "content"));
        chunks.put(chunk.id(), chunk);
        return chunk;
    }

    /**
     * Store the embedding of a chunk, replacing an existing one for the same
     * model and task.
     */
    synchronized void putEmbedding(ChunkEmbedding embedding) {
        if (!chunks.containsKey(embedding.chunkId())) {
            throw new DocumentStoreException("Chunk " + embedding.chunkId() + " does not exist");
        }
        int length = embedding.vector().length;
        if (length != dimensions) {
            throw new DocumentStoreException("Embedding has " + length + " dimensions, expected " + dimensions);
        }
        embeddings.put(new EmbeddingKey(embedding.chunkId(), embedding.model(), embedding.task()), embedding);
    }

    /**
     * Remove a document together with its chunks and their embeddings.
     *
     * @return {@code true} if the document existed
     */
    synchronized boolean deleteDocument(long documentId) {
        if (documents.remove(documentId) == null) {
            return false;
        }
        List<Long> removedChunks = new ArrayList<>();
        chunks.values().removeIf(chunk -> {
            boolean owned = chunk.documentId() == documentId;
            if (owned) {
                removedChunks.add(chunk.id());
            }
            return owned;
        });
        embeddings.keySet().removeIf(key -> removedChunks.contains(key.chunkId()));
        LOGGER.debug("Deleted document {} with {} chunks", documentId, removedChunks.size());
        return true;
    }

    synchronized List<DocumentChunk> chunksOf(long documentId) {
        return chunks.values().stream()
                .filter(chunk -> chunk.documentId() == documentId)
                .sorted(Comparator.comparingInt(DocumentChunk::index))
                .toList();
    }

    synchronized int chunkCount() {
        return chunks.size();
    }

    synchronized int embeddingCount() {
        return embeddings.size();
    }

    @Override
    public synchronized List<SearchResult> findNearest(float[] queryVector, Modality modality, int limit) {
        if (queryVector.length != dimensions) {
            throw new DocumentStoreException("Query vector has " + queryVector.length + " dimensions, expected "
                    + dimensions);
        }
        DistanceMetric metric = modality.metric();
        String model = modality.strategy().model();
        List<Candidate> candidates = new ArrayList<>();
        for (ChunkEmbedding embedding : embeddings.values()) {
            if (!embedding.model().equals(model) || !embedding.task().equals(modality.task())) {
                continue;
            }
            DocumentChunk chunk = chunks.get(embedding.chunkId());
            Document document = documents.get(chunk.documentId());
            candidates.add(new Candidate(document, chunk, metric.distance(queryVector, embedding.vector())));
        }
        List<SearchResult> results = candidates.stream()
                .sorted(Comparator.comparingDouble(Candidate::distance)
                        .thenComparingLong(candidate -> candidate.chunk().documentId())
                        .thenComparingInt(candidate -> candidate.chunk().index()))
                .limit(limit)
                .map(candidate -> candidate.toSearchResult(metric))
                .toList();
        LOGGER.debug("In-memory search for model {} and task {} matched {} of {} embeddings", model,
                modality.task(), candidates.size(), embeddings.size());
        return results;
    }

    private record EmbeddingKey(long chunkId, String model, String task) {
    }

    private record Candidate(Document document, DocumentChunk chunk, double distance) {

        SearchResult toSearchResult(DistanceMetric metric) {
            return new SearchResult(document.id(), document.name(), chunk.index(), chunk.content(),
                    metric.score(distance));
        }
    }
}
