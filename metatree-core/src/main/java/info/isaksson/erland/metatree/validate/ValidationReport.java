package info.isaksson.erland.metatree.validate;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import info.isaksson.erland.metatree.ir.Tier;

import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Outcome of a successful validation. Equal inputs give equal reports and identical
 * {@link #toJsonString()} output.
 */
public record ValidationReport(Tier level, int depth, int nodeCount, SortedSet<String> variables,
                               int nativeConstructCount, List<ValidationWarning> warnings) {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public ValidationReport {
        TreeSet<String> copy = new TreeSet<>();
        if (variables != null) copy.addAll(variables);
        variables = Collections.unmodifiableSortedSet(copy);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public int distinctVariableCount() {
        return variables.size();
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    public boolean hasWarning(ValidationWarning.Code code) {
        return warnings.stream().anyMatch(w -> w.code() == code);
    }

    public String toJsonString() {
        ObjectNode out = MAPPER.createObjectNode();
        out.put("level", level.wireName());
        out.put("depth", depth);
        out.put("nodeCount", nodeCount);
        out.put("distinctVariables", variables.size());
        ArrayNode vars = out.putArray("variables");
        variables.forEach(vars::add);
        out.put("nativeConstructCount", nativeConstructCount);
        ArrayNode ws = out.putArray("warnings");
        for (ValidationWarning w : warnings) {
            ObjectNode o = ws.addObject();
            o.put("code", w.code().wireName());
            o.put("value", w.value());
            o.put("message", w.message());
        }
        DefaultPrettyPrinter pp = new DefaultPrettyPrinter();
        DefaultIndenter indenter = new DefaultIndenter("  ", "\n");
        pp.indentObjectsWith(indenter);
        pp.indentArraysWith(indenter);
        try {
            return MAPPER.writer(pp).writeValueAsString(out) + "\n";
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize validation report", e);
        }
    }
}
