package info.isaksson.erland.metatree.binding;

import info.isaksson.erland.metatree.ir.MetaNode;

import java.util.Map;
import java.util.Set;

/**
 * Converts one language's native parse tree to the meta-tree and back.
 *
 * <p>Implementations must honour four obligations:</p>
 * <ol>
 *   <li>Every operation either succeeds or throws its named exception; nothing is returned half-built.</li>
 *   <li>Every abstraction conforms to the grammar. Constructs without a Tier-1/2/2s mapping become
 *       {@code language_specific} nodes that carry enough to be reified again.</li>
 *   <li>{@code unparse(reify(abstractTree(parse(s))))} is semantically equal to {@code s}; escape
 *       nodes are replayed verbatim.</li>
 *   <li>Equivalent programs in two languages abstract to equal trees once locations are stripped and
 *       names are normalized.</li>
 * </ol>
 *
 * <p>Bindings are stateless or immutable: they may be called from several threads at once.</p>
 *
 * @param <N> native tree type
 */
public interface LanguageBinding<N> {

    /** Language tag, e.g. {@code java}. Lower case, unique within a registry. */
    String language();

    N parse(String source) throws ParseException;

    Abstraction abstractTree(N nativeTree) throws AbstractionException;

    N reify(MetaNode tree, Map<String, String> metadata) throws ReificationException;

    String unparse(N nativeTree) throws UnparseException;

    /** Extensions including the dot, e.g. {@code .java}. */
    Set<String> fileExtensions();

    /** Optional check run before an edited tree replaces a document's tree. Accepts everything by default. */
    default void validateMutation(MetaNode tree, Map<String, String> metadata) throws MutationRejectedException {
    }
}
