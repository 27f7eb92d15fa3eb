package info.isaksson.erland.metatree.ir;

import java.util.List;

/**
 * Native scope facts recorded at a structural boundary ({@link Container}, {@link FunctionDef}).
 *
 * <p>The context belongs to the boundary node only. Descendants never see it, so a subtree taken
 * out of its boundary is self-contained.</p>
 *
 * @param module    enclosing module/class/package name as the source language spells it, or null
 * @param function  function name when the boundary is a function, or null
 * @param arity     number of parameters when the boundary is a function, or null
 * @param modifiers native modifiers (e.g. {@code static}, {@code final}) in source order
 */
public record BoundaryContext(String module, String function, Integer arity, List<String> modifiers) {

    public static final BoundaryContext EMPTY = new BoundaryContext(null, null, null, List.of());

    public BoundaryContext {
        modifiers = modifiers == null ? List.of() : List.copyOf(modifiers);
    }

    public static BoundaryContext ofModule(String module, List<String> modifiers) {
        return new BoundaryContext(module, null, null, modifiers);
    }

    public static BoundaryContext ofFunction(String module, String function, int arity, List<String> modifiers) {
        return new BoundaryContext(module, function, arity, modifiers);
    }

    public boolean hasModifier(String modifier) {
        return modifiers.contains(modifier);
    }

    public boolean isEmpty() {
        return module == null && function == null && arity == null && modifiers.isEmpty();
    }
}
