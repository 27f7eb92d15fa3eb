package info.isaksson.erland.metatree.core;

import java.util.ArrayList;
import java.util.List;

/**
 * Options for {@link CorpusProcessor}. Mirrors the CLI {@code scan} flags.
 */
public final class CorpusOptions {
    /** Worker threads; each file is processed independently. */
    public int threads = Math.max(1, Runtime.getRuntime().availableProcessors());

    /** Glob patterns, relative to the corpus root, of files to skip. */
    public List<String> excludeGlobs = new ArrayList<>();

    /** Restrict processing to these language tags. Empty means every registered language. */
    public List<String> languages = new ArrayList<>();
}
