package info.isaksson.erland.metatree.core;

import info.isaksson.erland.metatree.binding.Abstraction;
import info.isaksson.erland.metatree.binding.CrossBindingTranslationException;
import info.isaksson.erland.metatree.binding.DefaultBindingRegistry;
import info.isaksson.erland.metatree.binding.LanguageBinding;
import info.isaksson.erland.metatree.binding.MetaTreeException;
import info.isaksson.erland.metatree.binding.ReificationException;
import info.isaksson.erland.metatree.binding.UnsupportedLanguageException;
import info.isaksson.erland.metatree.ir.Conformance;
import info.isaksson.erland.metatree.ir.Document;
import info.isaksson.erland.metatree.ir.MetaNode;
import info.isaksson.erland.metatree.ir.MetaNodes;
import info.isaksson.erland.metatree.supplemental.SupplementalRegistry;
import info.isaksson.erland.metatree.validate.ValidationException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Source text to {@link Document} and back, through whichever binding the registry holds for a
 * language.
 *
 * <p>CLI and other front ends should use this class instead of re-implementing the pipeline. Every
 * method either returns a complete result or throws the first stage's failure; no partial
 * Document is ever built.</p>
 */
public final class MetaTreeBuilder {

    private static final Logger LOG = Logger.getLogger(MetaTreeBuilder.class.getName());

    private final DefaultBindingRegistry registry;
    private final SupplementalRegistry supplementals;

    public MetaTreeBuilder(DefaultBindingRegistry registry) {
        this(registry, new SupplementalRegistry());
    }

    public MetaTreeBuilder(DefaultBindingRegistry registry, SupplementalRegistry supplementals) {
        if (registry == null) throw new IllegalArgumentException("registry must not be null");
        if (supplementals == null) throw new IllegalArgumentException("supplementals must not be null");
        this.registry = registry;
        this.supplementals = supplementals;
    }

    /** Builder over every binding and supplemental installed on the class path. */
    public static MetaTreeBuilder withInstalledBindings() {
        return new MetaTreeBuilder(DefaultBindingRegistry.loadInstalled(), SupplementalRegistry.loadInstalled());
    }

    public DefaultBindingRegistry registry() {
        return registry;
    }

    public SupplementalRegistry supplementals() {
        return supplementals;
    }

    /** Parse, abstract and wrap {@code source}. */
    public Document fromSource(String source, String language) throws MetaTreeException {
        if (source == null) throw new IllegalArgumentException("source must not be null");
        LanguageBinding<?> binding = registry.require(language);
        Abstraction abstraction = abstractSource(binding, source);
        MetaNode tree = abstraction.tree();
        if (!Conformance.conforms(tree)) {
            throw new ValidationException(ValidationException.Reason.INVALID_STRUCTURE,
                    binding.language() + " binding produced a non-conforming tree rooted at " + tree.tag().wireName());
        }
        return Document.of(tree, binding.language(), abstraction.metadata(), source);
    }

    /** Read a file, detecting the language from its extension. */
    public Document fromFile(Path path) throws MetaTreeException, IOException {
        return fromFile(path, null);
    }

    /** Read a file as {@code language}; a null language means detect it from the extension. */
    public Document fromFile(Path path, String language) throws MetaTreeException, IOException {
        if (path == null) throw new IllegalArgumentException("path must not be null");
        String lang = language != null ? language : detect(path);
        return fromSource(Files.readString(path, StandardCharsets.UTF_8), lang);
    }

    public String detect(Path path) throws UnsupportedLanguageException {
        String name = path.getFileName() == null ? path.toString() : path.getFileName().toString();
        return registry.detectLanguage(name).orElseThrow(() -> new UnsupportedLanguageException(name));
    }

    /** Regenerate source in the document's own language. */
    public String toSource(Document document) throws MetaTreeException {
        if (document == null) throw new IllegalArgumentException("document must not be null");
        return toSource(document, document.language());
    }

    /**
     * Regenerate source in {@code targetLanguage}. Sending a tree to another language's binding
     * requires it to be free of escape nodes; otherwise a {@link CrossBindingTranslationException}
     * is thrown before the target binding is called.
     *
     * <p>When the target binding cannot reify a node, the supplementals registered for the target
     * language get one chance to rewrite the tree; the original failure is rethrown if none
     * applies.</p>
     */
    public String toSource(Document document, String targetLanguage) throws MetaTreeException {
        if (document == null) throw new IllegalArgumentException("document must not be null");
        String target = targetLanguage == null ? document.language() : targetLanguage;
        LanguageBinding<?> binding = registry.require(target);
        if (!binding.language().equals(document.language()) && MetaNodes.containsNative(document.tree())) {
            throw new CrossBindingTranslationException(document.language(), binding.language(),
                    MetaNodes.nativeEscapes(document.tree()).size());
        }
        // Source-language reconstruction hints do not apply to another language.
        Map<String, String> metadata = binding.language().equals(document.language()) ? document.metadata() : Map.of();
        try {
            return reifyAndUnparse(binding, document.tree(), metadata);
        } catch (ReificationException e) {
            MetaNode supplemented = supplementals.apply(document.tree(), binding.language(), metadata);
            if (supplemented.equals(document.tree())) throw e;
            if (!Conformance.conforms(supplemented)) {
                throw new ReificationException(e.tag(), binding.language(),
                        "supplemental rewrite produced a non-conforming tree");
            }
            LOG.fine(() -> "Retrying " + binding.language() + " reification after supplemental rewrite: " + e.getMessage());
            return reifyAndUnparse(binding, supplemented, metadata);
        }
    }

    public void toFile(Document document, Path path) throws MetaTreeException, IOException {
        toFile(document, path, null);
    }

    public void toFile(Document document, Path path, String targetLanguage) throws MetaTreeException, IOException {
        if (path == null) throw new IllegalArgumentException("path must not be null");
        String text = toSource(document, targetLanguage);
        Path parent = path.toAbsolutePath().normalize().getParent();
        if (parent != null) Files.createDirectories(parent);
        Files.writeString(path, text, StandardCharsets.UTF_8);
    }

    /** {@code toSource(fromSource(source, language))}. */
    public String roundTrip(String source, String language) throws MetaTreeException {
        return toSource(fromSource(source, language));
    }

    /** True when {@code source} parses and abstracts under {@code language}. */
    public boolean isValidSource(String source, String language) {
        try {
            fromSource(source, language);
            return true;
        } catch (MetaTreeException e) {
            return false;
        }
    }

    public List<String> supportedLanguages() {
        return registry.list();
    }

    /**
     * Replace a document's tree with an edited one. The new tree must conform and pass the
     * document language's {@link LanguageBinding#validateMutation} hook.
     */
    public Document applyMutation(Document document, MetaNode newTree) throws MetaTreeException {
        if (document == null) throw new IllegalArgumentException("document must not be null");
        if (!Conformance.conforms(newTree)) {
            throw new ValidationException(ValidationException.Reason.INVALID_STRUCTURE,
                    "mutated tree does not conform");
        }
        registry.require(document.language()).validateMutation(newTree, document.metadata());
        return document.withTree(newTree);
    }

    private static <N> Abstraction abstractSource(LanguageBinding<N> binding, String source) throws MetaTreeException {
        N nativeTree = binding.parse(source);
        return binding.abstractTree(nativeTree);
    }

    private static <N> String reifyAndUnparse(LanguageBinding<N> binding, MetaNode tree, Map<String, String> metadata)
            throws MetaTreeException {
        N nativeTree = binding.reify(tree, metadata);
        return binding.unparse(nativeTree);
    }
}
