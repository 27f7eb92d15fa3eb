package info.isaksson.erland.metatree.java;

import info.isaksson.erland.metatree.binding.CrossBindingTranslationException;
import info.isaksson.erland.metatree.binding.DefaultBindingRegistry;
import info.isaksson.erland.metatree.binding.MiniExprBinding;
import info.isaksson.erland.metatree.binding.ReificationException;
import info.isaksson.erland.metatree.core.MetaTreeBuilder;
import info.isaksson.erland.metatree.ir.AsyncKind;
import info.isaksson.erland.metatree.ir.AsyncOperation;
import info.isaksson.erland.metatree.ir.Document;
import info.isaksson.erland.metatree.ir.FunctionCall;
import info.isaksson.erland.metatree.ir.Literal;
import info.isaksson.erland.metatree.ir.MetaNode;
import info.isaksson.erland.metatree.ir.NodeMeta;
import info.isaksson.erland.metatree.ir.NodeTag;
import info.isaksson.erland.metatree.ir.Variable;
import info.isaksson.erland.metatree.supplemental.SupplementalRegistry;
import info.isaksson.erland.metatree.validate.ValidationException;
import info.isaksson.erland.metatree.validate.ValidationLimits;
import info.isaksson.erland.metatree.validate.ValidationMode;
import info.isaksson.erland.metatree.validate.ValidationReport;
import info.isaksson.erland.metatree.validate.ValidationWarning;
import info.isaksson.erland.metatree.validate.Validator;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class JavaTranslationTest {

    @TempDir
    Path tmp;

    private final MetaTreeBuilder builder = new MetaTreeBuilder(new DefaultBindingRegistry()
            .register(new JavaBinding())
            .register(MiniExprBinding.lower())
            .register(MiniExprBinding.capitalized()));

    @Test
    void installedBindingIsDiscovered() {
        DefaultBindingRegistry registry = DefaultBindingRegistry.loadInstalled();
        assertTrue(registry.lookup("java").isPresent());
        assertEquals("java", registry.detectLanguage("Cart.java").orElseThrow());
    }

    @Test
    void expressionsTranslateBothWays() throws Exception {
        Document fromMini = builder.fromSource("x + 5", "mini");
        assertEquals("x + 5", builder.toSource(fromMini, "java"));

        Document fromJava = builder.fromSource("price * (count - 1)", "java");
        assertEquals("Price * (Count - 1).", builder.toSource(fromJava, "erlmini"));
    }

    @Test
    void statementSequencesTranslateBothWays() throws Exception {
        Document fromMini = builder.fromSource("a = 1; b = a + a", "mini");
        assertEquals("a = 1;\nb = a + a;", builder.toSource(fromMini, "java"));

        Document fromJava = builder.fromSource("a = 1;\nb = a + a;", "java");
        assertEquals("A = 1, B = A + A.", builder.toSource(fromJava, "erlmini"));
        assertEquals(2, new Validator().validate(fromJava).distinctVariableCount());
    }

    @Test
    void javaEscapesStayInJava() throws Exception {
        Document doc = builder.fromSource("x + (y << 2)", "java");
        CrossBindingTranslationException e = assertThrows(CrossBindingTranslationException.class,
                () -> builder.toSource(doc, "mini"));
        assertEquals("java", e.sourceLanguage());
        assertEquals(1, e.nativeCount());
        assertEquals("x + (y << 2)", builder.toSource(doc));
    }

    @Test
    void validationModesTreatJavaEscapes() throws Exception {
        Document doc = builder.fromSource("switch (k) { default: k = 0; }", "java");
        Validator validator = new Validator();

        ValidationException strict = assertThrows(ValidationException.class,
                () -> validator.validate(doc, ValidationMode.STRICT, ValidationLimits.DEFAULTS));
        assertEquals(ValidationException.Reason.NATIVE_CONSTRUCT_IN_STRICT_MODE, strict.reason());

        ValidationReport standard = validator.validate(doc, ValidationMode.STANDARD, ValidationLimits.DEFAULTS);
        assertEquals(1, standard.warnings().size());
        assertTrue(standard.hasWarning(ValidationWarning.Code.NATIVE_CONSTRUCTS_PRESENT));

        ValidationReport permissive = validator.validate(doc, ValidationMode.PERMISSIVE, ValidationLimits.DEFAULTS);
        assertTrue(permissive.warnings().isEmpty());
    }

    @Test
    void javaFilesRoundTripThroughDisk() throws Exception {
        Path in = tmp.resolve("Greeter.java");
        Files.writeString(in, "class Greeter {\n    String greet(String who) {\n        return \"Hello, \" + who;\n    }\n}\n",
                StandardCharsets.UTF_8);
        Document doc = builder.fromFile(in);
        assertEquals("java", doc.language());
        assertEquals("compilation_unit", doc.metadata(JavaNativeTree.METADATA_KEY).orElseThrow());

        Path out = tmp.resolve("out/Greeter.java");
        builder.toFile(doc, out);
        Document again = builder.fromFile(out);
        assertTrue(Document.equivalent(doc, again));
    }

    @Test
    void asyncOperationsReachJavaThroughCompletableFuture() throws Exception {
        SupplementalRegistry installed = SupplementalRegistry.loadInstalled();
        assertEquals(List.of("java-completable-future"),
                installed.listForLanguage("java").stream().map(s -> s.info().name()).toList());
        MetaTreeBuilder withSupplementals = new MetaTreeBuilder(builder.registry(), installed);

        MetaNode fetch = FunctionCall.of("fetch", List.of(Literal.integer(1)));
        Document spawned = Document.of(new AsyncOperation(AsyncKind.ASYNC, fetch, NodeMeta.EMPTY), "mini");
        assertEquals("java.util.concurrent.CompletableFuture.supplyAsync(() -> fetch(1))",
                withSupplementals.toSource(spawned, "java"));

        Document joined = Document.of(new AsyncOperation(AsyncKind.AWAIT, Variable.named("job"), NodeMeta.EMPTY), "mini");
        assertEquals("job.join()", withSupplementals.toSource(joined, "java"));

        ReificationException e = assertThrows(ReificationException.class, () -> builder.toSource(spawned, "java"));
        assertEquals(NodeTag.ASYNC_OPERATION, e.tag());
        // Awaiting an arbitrary expression has no CompletableFuture form.
        Document awaitCall = Document.of(new AsyncOperation(AsyncKind.AWAIT, fetch, NodeMeta.EMPTY), "mini");
        assertThrows(ReificationException.class, () -> withSupplementals.toSource(awaitCall, "java"));
    }
}
