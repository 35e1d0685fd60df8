package eu.virtualparadox.hybridrag.catalog.service;

import eu.virtualparadox.hybridrag.catalog.model.DocumentRecord;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory catalog of ingested documents and their extracted text.
 * <p>
 * Responsibilities:
 * <ul>
 *     <li>Issuing document identifiers</li>
 *     <li>Keeping records and extracted text together, keyed by document id</li>
 *     <li>Lookup by content hash for duplicate detection</li>
 * </ul>
 * Contents are lost on restart. Indexes referencing a document are maintained by the caller,
 * with the {@code docId} acting as the link.
 */
@Service
public class DocumentStore {

    private final Map<String, StoredDocument> documents = new ConcurrentHashMap<>();

    /**
     * Generates a new unique identifier for a document.
     * <p>
     * A UUID with dashes removed (32 hex characters).
     *
     * @return new document identifier
     */
    public String newId() {
        return UUID.randomUUID().toString().replace("-", "");
    }

    /**
     * Registers a document and its extracted text, replacing any entry with the same id.
     *
     * @param document catalog record
     * @param text     extracted text
     */
    public void save(final DocumentRecord document, final String text) {
        Objects.requireNonNull(document, "document must not be null");
        Objects.requireNonNull(document.id(), "document.id must not be null");
        documents.put(document.id(), new StoredDocument(document, text == null ? "" : text));
    }

    public Optional<DocumentRecord> findById(final String id) {
        final StoredDocument stored = id == null ? null : documents.get(id);
        return stored == null ? Optional.empty() : Optional.of(stored.document());
    }

    /**
     * @param hash MD5 hex digest of the file bytes
     * @return the document with this content hash, if any
     */
    public Optional<DocumentRecord> findByHash(final String hash) {
        return documents.values().stream()
                .map(StoredDocument::document)
                .filter(d -> Objects.equals(d.hash(), hash))
                .findFirst();
    }

    public Optional<String> getText(final String id) {
        final StoredDocument stored = id == null ? null : documents.get(id);
        return stored == null ? Optional.empty() : Optional.of(stored.text());
    }

    /**
     * @return all documents, newest upload first
     */
    public List<DocumentRecord> listAll() {
        return documents.values().stream()
                .map(StoredDocument::document)
                .sorted(Comparator.comparing(DocumentRecord::uploadedAt).reversed())
                .toList();
    }

    /**
     * @param id document identifier
     * @return {@code true} if a document was removed
     */
    public boolean delete(final String id) {
        return id != null && documents.remove(id) != null;
    }

    public int count() {
        return documents.size();
    }

    private record StoredDocument(DocumentRecord document, String text) {
    }
}
