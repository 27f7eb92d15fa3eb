package info.isaksson.erland.metatree.supplemental;

import info.isaksson.erland.metatree.ir.MetaNode;
import info.isaksson.erland.metatree.ir.MetaNodeRewriter;
import info.isaksson.erland.metatree.ir.NodeTag;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Thread-safe registry of {@link Supplemental}s keyed by target language and node kind. At most one
 * supplemental may claim a given construct for a language.
 */
public final class SupplementalRegistry {

    private static final Logger LOG = Logger.getLogger(SupplementalRegistry.class.getName());

    private record Key(String language, NodeTag tag) {}

    private final ConcurrentMap<String, Supplemental> byName = new ConcurrentHashMap<>();
    private final ConcurrentMap<Key, Supplemental> byConstruct = new ConcurrentHashMap<>();

    public SupplementalRegistry() {}

    public static SupplementalRegistry loadInstalled() {
        return loadInstalled(Thread.currentThread().getContextClassLoader());
    }

    public static SupplementalRegistry loadInstalled(ClassLoader loader) {
        SupplementalRegistry registry = new SupplementalRegistry();
        Iterator<Supplemental> it = ServiceLoader.load(Supplemental.class, loader).iterator();
        while (true) {
            Supplemental next;
            try {
                if (!it.hasNext()) break;
                next = it.next();
            } catch (ServiceConfigurationError e) {
                LOG.log(Level.WARNING, "Skipping supplemental: " + e.getMessage(), e);
                continue;
            }
            Supplemental supplemental = next;
            try {
                registry.register(supplemental);
                LOG.fine(() -> "Discovered supplemental '" + supplemental.info().name() + "' for "
                        + supplemental.info().language());
            } catch (IllegalArgumentException e) {
                LOG.log(Level.WARNING, "Skipping supplemental " + supplemental.getClass().getName() + ": " + e.getMessage(), e);
            }
        }
        return registry;
    }

    /**
     * Adds a supplemental. Fails without registering anything when its name is taken or another
     * supplemental already handles one of its constructs for the same language.
     */
    public synchronized SupplementalRegistry register(Supplemental supplemental) {
        if (supplemental == null) throw new IllegalArgumentException("supplemental is null");
        SupplementalInfo info = supplemental.info();
        if (info == null) throw new IllegalArgumentException(supplemental.getClass().getName() + " has no info");
        if (byName.containsKey(info.name())) {
            throw new IllegalArgumentException("Supplemental '" + info.name() + "' is already registered");
        }
        for (NodeTag tag : info.constructs()) {
            Supplemental owner = byConstruct.get(new Key(info.language(), tag));
            if (owner != null) {
                throw new IllegalArgumentException(tag.wireName() + " in " + info.language()
                        + " is already handled by '" + owner.info().name() + "'");
            }
        }
        byName.put(info.name(), supplemental);
        for (NodeTag tag : info.constructs()) byConstruct.put(new Key(info.language(), tag), supplemental);
        LOG.finer(() -> "Registered supplemental '" + info.name() + "' for " + info.constructs());
        return this;
    }

    public synchronized boolean unregister(String name) {
        Supplemental removed = byName.remove(name);
        if (removed == null) return false;
        byConstruct.values().removeIf(s -> s == removed);
        return true;
    }

    public Optional<Supplemental> lookup(String language, NodeTag tag) {
        if (language == null || tag == null) return Optional.empty();
        return Optional.ofNullable(byConstruct.get(new Key(key(language), tag)));
    }

    /** Supplementals targeting {@code language}, by name. */
    public List<Supplemental> listForLanguage(String language) {
        String k = key(language);
        List<Supplemental> out = new ArrayList<>();
        for (Supplemental s : byName.values()) {
            if (s.info().language().equals(k)) out.add(s);
        }
        out.sort(Comparator.comparing(s -> s.info().name()));
        return out;
    }

    public Set<NodeTag> availableConstructs(String language) {
        Set<NodeTag> out = EnumSet.noneOf(NodeTag.class);
        for (Supplemental s : listForLanguage(language)) out.addAll(s.info().constructs());
        return out;
    }

    /** Every registered supplemental, by name. */
    public List<SupplementalInfo> list() {
        List<SupplementalInfo> out = new ArrayList<>();
        for (Supplemental s : byName.values()) out.add(s.info());
        out.sort(Comparator.comparing(SupplementalInfo::name));
        return out;
    }

    /**
     * Rewrites every node a supplemental handles for {@code language}, children first. Nodes whose
     * supplemental declines them are kept as they are.
     */
    public MetaNode apply(MetaNode tree, String language, Map<String, String> metadata) {
        if (tree == null) throw new IllegalArgumentException("tree is null");
        String target = key(language);
        if (listForLanguage(target).isEmpty()) return tree;
        Map<String, String> md = metadata == null ? Map.of() : metadata;
        return new MetaNodeRewriter() {
            @Override public MetaNode rewrite(MetaNode node) {
                MetaNode rebuilt = super.rewrite(node);
                if (rebuilt == null) return null;
                Optional<Supplemental> s = lookup(target, rebuilt.tag());
                if (s.isEmpty()) return rebuilt;
                Optional<MetaNode> replacement = s.get().transform(rebuilt, target, md);
                if (replacement.isPresent()) {
                    LOG.finer(() -> "'" + s.get().info().name() + "' rewrote " + rebuilt.tag().wireName());
                    return replacement.get();
                }
                return rebuilt;
            }
        }.rewrite(tree);
    }

    private static String key(String language) {
        return language == null ? "" : language.trim().toLowerCase(Locale.ROOT);
    }
}
