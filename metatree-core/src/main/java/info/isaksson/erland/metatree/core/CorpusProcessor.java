package info.isaksson.erland.metatree.core;

import info.isaksson.erland.metatree.binding.MetaTreeException;
import info.isaksson.erland.metatree.io.SourceScanner;
import info.isaksson.erland.metatree.ir.Document;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.logging.Logger;

/**
 * Builds one {@link Document} per source file under a root, on a worker pool.
 *
 * <p>Files share nothing: a failure in one file is recorded in the result and never affects
 * another file.</p>
 */
public final class CorpusProcessor {

    private static final Logger LOG = Logger.getLogger(CorpusProcessor.class.getName());

    private final MetaTreeBuilder builder;

    public CorpusProcessor(MetaTreeBuilder builder) {
        if (builder == null) throw new IllegalArgumentException("builder must not be null");
        this.builder = builder;
    }

    public CorpusResult process(Path root, List<String> excludeGlobs) throws IOException {
        CorpusOptions options = new CorpusOptions();
        if (excludeGlobs != null) options.excludeGlobs.addAll(excludeGlobs);
        return process(root, options);
    }

    public CorpusResult process(Path root, CorpusOptions options) throws IOException {
        if (root == null) throw new IllegalArgumentException("root must not be null");
        if (options == null) options = new CorpusOptions();

        Collection<String> extensions = extensionsFor(options.languages);
        List<Path> files = SourceScanner.scan(root, extensions, options.excludeGlobs);
        LOG.fine(() -> "Found " + files.size() + " source file(s) under " + root);

        List<CorpusResult.Entry> documents = new ArrayList<>();
        List<CorpusResult.Failure> failures = new ArrayList<>();
        if (files.isEmpty()) return new CorpusResult(documents, failures);

        ExecutorService pool = Executors.newFixedThreadPool(Math.max(1, Math.min(options.threads, files.size())));
        try {
            List<Future<Outcome>> futures = new ArrayList<>(files.size());
            for (Path file : files) {
                futures.add(pool.submit(() -> processOne(file)));
            }
            // Files are already sorted by relative path; collecting in submission order keeps that order.
            for (int i = 0; i < files.size(); i++) {
                String rel = SourceScanner.relative(root, files.get(i));
                Outcome outcome = await(futures.get(i), rel);
                if (outcome.document() != null) {
                    documents.add(new CorpusResult.Entry(rel, outcome.document()));
                } else {
                    Throwable t = outcome.error();
                    failures.add(new CorpusResult.Failure(rel, t.getClass().getSimpleName(), t.getMessage()));
                    LOG.fine(() -> rel + ": " + t.getClass().getSimpleName() + ": " + t.getMessage());
                }
            }
        } finally {
            pool.shutdownNow();
        }
        LOG.fine(() -> "Corpus " + root + ": " + documents.size() + " document(s), " + failures.size() + " failure(s)");
        return new CorpusResult(documents, failures);
    }

    /** Either the document or the failure that stopped this file's pipeline. */
    private record Outcome(Document document, Throwable error) {}

    private Outcome processOne(Path file) {
        try {
            return new Outcome(builder.fromFile(file), null);
        } catch (MetaTreeException | IOException | RuntimeException e) {
            return new Outcome(null, e);
        }
    }

    private static Outcome await(Future<Outcome> future, String rel) throws IOException {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while processing " + rel, e);
        } catch (ExecutionException e) {
            return new Outcome(null, e.getCause() == null ? e : e.getCause());
        }
    }

    private Collection<String> extensionsFor(List<String> languages) {
        List<String> out = new ArrayList<>();
        builder.registry().extensions().forEach((ext, lang) -> {
            if (languages == null || languages.isEmpty() || languages.contains(lang)) out.add(ext);
        });
        return out;
    }
}
