package info.isaksson.erland.metatree.binding;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Thread-safe registry keyed by language tag, with a secondary index from file extension to tag.
 *
 * <p>{@link #loadInstalled()} discovers bindings declared in
 * {@code META-INF/services/info.isaksson.erland.metatree.binding.LanguageBinding}.</p>
 */
public final class DefaultBindingRegistry implements BindingRegistry {

    private static final Logger LOG = Logger.getLogger(DefaultBindingRegistry.class.getName());

    private final ConcurrentMap<String, LanguageBinding<?>> byLanguage = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, String> languageByExtension = new ConcurrentHashMap<>();

    public DefaultBindingRegistry() {}

    /** Registry pre-filled with every binding found on the class path. */
    public static DefaultBindingRegistry loadInstalled() {
        return loadInstalled(Thread.currentThread().getContextClassLoader());
    }

    @SuppressWarnings("rawtypes")
    public static DefaultBindingRegistry loadInstalled(ClassLoader loader) {
        DefaultBindingRegistry registry = new DefaultBindingRegistry();
        Iterator<LanguageBinding> it = ServiceLoader.load(LanguageBinding.class, loader).iterator();
        while (true) {
            LanguageBinding<?> next;
            try {
                if (!it.hasNext()) break;
                next = it.next();
            } catch (ServiceConfigurationError e) {
                // The loader moves on to the next provider after a broken one.
                LOG.log(Level.WARNING, "Skipping binding: " + e.getMessage(), e);
                continue;
            }
            LanguageBinding<?> binding = next;
            try {
                registry.register(binding);
                LOG.fine(() -> "Discovered binding '" + binding.language() + "' (" + binding.getClass().getName() + ")");
            } catch (IllegalArgumentException e) {
                LOG.log(Level.WARNING, "Skipping binding " + binding.getClass().getName() + ": " + e.getMessage(), e);
            }
        }
        return registry;
    }

    /**
     * Adds a binding. A second binding for the same language tag is rejected; unregister first.
     */
    public DefaultBindingRegistry register(LanguageBinding<?> binding) {
        if (binding == null) throw new IllegalArgumentException("binding is null");
        String language = key(binding.language());
        if (language.isEmpty()) throw new IllegalArgumentException("binding language is blank");
        LanguageBinding<?> previous = byLanguage.putIfAbsent(language, binding);
        if (previous != null && previous != binding) {
            throw new IllegalArgumentException("Language '" + language + "' is already bound to " + previous.getClass().getName());
        }
        for (String ext : binding.fileExtensions()) {
            String e = extension(ext);
            String owner = languageByExtension.putIfAbsent(e, language);
            if (owner != null && !owner.equals(language)) {
                LOG.fine(() -> "Extension " + e + " stays with '" + owner + "'; ignored for '" + language + "'");
            }
        }
        LOG.finer(() -> "Registered binding '" + language + "' for " + binding.fileExtensions());
        return this;
    }

    public boolean unregister(String language) {
        String k = key(language);
        LanguageBinding<?> removed = byLanguage.remove(k);
        if (removed == null) return false;
        languageByExtension.values().removeIf(k::equals);
        return true;
    }

    @Override
    public Optional<LanguageBinding<?>> lookup(String language) {
        if (language == null) return Optional.empty();
        return Optional.ofNullable(byLanguage.get(key(language)));
    }

    public LanguageBinding<?> require(String language) throws UnsupportedLanguageException {
        return lookup(language).orElseThrow(() -> new UnsupportedLanguageException(language));
    }

    /** Language tag for a file name, by its (last) extension. */
    public Optional<String> detectLanguage(String fileName) {
        if (fileName == null) return Optional.empty();
        String name = fileName.replace('\\', '/');
        name = name.substring(name.lastIndexOf('/') + 1);
        int dot = name.lastIndexOf('.');
        if (dot <= 0) return Optional.empty();
        return Optional.ofNullable(languageByExtension.get(extension(name.substring(dot))));
    }

    /** Registered language tags, sorted. */
    public List<String> list() {
        List<String> out = new ArrayList<>(byLanguage.keySet());
        Collections.sort(out);
        return Collections.unmodifiableList(out);
    }

    /** Extension to language tag view, for diagnostics. */
    public Map<String, String> extensions() {
        return Map.copyOf(languageByExtension);
    }

    private static String key(String language) {
        return language == null ? "" : language.trim().toLowerCase(Locale.ROOT);
    }

    private static String extension(String ext) {
        String e = ext.trim().toLowerCase(Locale.ROOT);
        return e.startsWith(".") ? e : "." + e;
    }
}
