package info.isaksson.erland.metatree.java;

import info.isaksson.erland.metatree.ir.AsyncKind;
import info.isaksson.erland.metatree.ir.AsyncOperation;
import info.isaksson.erland.metatree.ir.FunctionCall;
import info.isaksson.erland.metatree.ir.Lambda;
import info.isaksson.erland.metatree.ir.MetaNode;
import info.isaksson.erland.metatree.ir.NodeMeta;
import info.isaksson.erland.metatree.ir.NodeTag;
import info.isaksson.erland.metatree.ir.Variable;
import info.isaksson.erland.metatree.supplemental.Supplemental;
import info.isaksson.erland.metatree.supplemental.SupplementalInfo;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Async operations as {@link java.util.concurrent.CompletableFuture} calls: {@code async op} becomes
 * {@code CompletableFuture.supplyAsync(() -> op)} and {@code await f} on a variable becomes
 * {@code f.join()}. Awaiting anything else is left for the binding to reject.
 */
public final class CompletableFutureSupplemental implements Supplemental {

    static final String SUPPLY_ASYNC = "java.util.concurrent.CompletableFuture.supplyAsync";

    private static final SupplementalInfo INFO = new SupplementalInfo("java-completable-future", JavaBinding.LANGUAGE,
            Set.of(NodeTag.ASYNC_OPERATION), List.of("java.base"),
            "async and await as CompletableFuture.supplyAsync and join");

    @Override public SupplementalInfo info() {
        return INFO;
    }

    @Override public Optional<MetaNode> transform(MetaNode node, String language, Map<String, String> metadata) {
        if (!(node instanceof AsyncOperation op)) return Optional.empty();
        if (op.kind() == AsyncKind.ASYNC) {
            Lambda supplier = new Lambda(List.of(), List.of(op.operation()), NodeMeta.EMPTY);
            return Optional.of(new FunctionCall(SUPPLY_ASYNC, List.of(supplier), op.meta()));
        }
        if (op.operation() instanceof Variable v) {
            return Optional.of(new FunctionCall(v.name() + ".join", List.of(), op.meta()));
        }
        return Optional.empty();
    }
}
