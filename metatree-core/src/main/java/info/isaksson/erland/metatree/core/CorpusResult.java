package info.isaksson.erland.metatree.core;

import info.isaksson.erland.metatree.ir.Document;

import java.util.List;

/** Corpus result container. Both lists are sorted by relative path. */
public final class CorpusResult {

    /** A file that produced a document. */
    public record Entry(String path, Document document) {}

    /** A file whose pipeline stopped; {@code errorType} is the simple name of the failure. */
    public record Failure(String path, String errorType, String message) {}

    public final List<Entry> documents;
    public final List<Failure> failures;

    CorpusResult(List<Entry> documents, List<Failure> failures) {
        this.documents = List.copyOf(documents);
        this.failures = List.copyOf(failures);
    }

    public int fileCount() {
        return documents.size() + failures.size();
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }
}
