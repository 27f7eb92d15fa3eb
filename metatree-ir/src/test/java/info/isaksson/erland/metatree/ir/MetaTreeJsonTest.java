package info.isaksson.erland.metatree.ir;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class MetaTreeJsonTest {

    @TempDir
    Path tmp;

    @Test
    void writeMatchesGoldenDocument() throws Exception {
        Path goldenPath = resource("tree/golden/module-document.json");
        String golden = Files.readString(goldenPath, StandardCharsets.UTF_8);

        Document doc = MetaTreeJson.read(goldenPath);
        assertEquals(Document.of(Trees.demoModule(), "mini", Map.of("mini.style", "lower"), null), doc);

        ObjectMapper om = new ObjectMapper();
        JsonNode goldenNode = om.readTree(golden);
        assertEquals(goldenNode, om.readTree(MetaTreeJson.toJsonString(doc)));

        Path out1 = tmp.resolve("a/doc.json");
        Path out2 = tmp.resolve("b/doc.json");
        MetaTreeJson.write(doc, out1);
        MetaTreeJson.write(doc, out2);
        String written = Files.readString(out1, StandardCharsets.UTF_8);
        assertEquals(written, Files.readString(out2, StandardCharsets.UTF_8), "Writing twice must produce identical output.");
        assertTrue(written.endsWith("}\n"));
    }

    @Test
    void nodeRoundTripsThroughJson() throws IOException {
        MetaNode[] trees = {
                Trees.xPlus5(),
                Trees.twoAssignments(),
                Trees.demoModule(),
                new ExceptionHandling(Block.of(List.of(Trees.xPlus5())),
                        List.of(new MatchArm(Param.typed("e", "IOException"), null, List.of(), NodeMeta.EMPTY)),
                        Block.of(List.of()), NodeMeta.EMPTY),
                new CollectionOp(CollectionOpKind.REDUCE, Variable.named("f"), Variable.named("xs"), Literal.integer(0), NodeMeta.EMPTY),
                Loop.whileLoop(Literal.bool(true), Block.of(List.of())),
                new Literal(LiteralSubtype.FLOAT, 2.5, NodeMeta.at(1, 1)),
                Literal.nullValue()
        };
        for (MetaNode tree : trees) {
            assertEquals(tree, MetaTreeJson.readNode(MetaTreeJson.toJsonString(tree)), tree.tag().wireName());
        }
    }

    @Test
    void nativePayloadIsKeptVerbatim() throws IOException {
        String payload = "switch (k) {\n  case 1 -> \"one\";\n  default -> \"\\u00e9\";\n}";
        MetaNode escape = NativeEscape.of("java", "switch_statement", payload);
        NativeEscape back = (NativeEscape) MetaTreeJson.readNode(MetaTreeJson.toJsonString(escape));
        assertEquals(payload, back.payload());
    }

    @Test
    void unknownTagIsRejected() {
        String json = "{\"tag\":\"goto\",\"meta\":{},\"payload\":[]}";
        MetaTreeFormatException e = assertThrows(MetaTreeFormatException.class, () -> MetaTreeJson.readNode(json));
        assertTrue(e.getMessage().contains("goto"));
        assertEquals("$.tag", e.path());
    }

    @Test
    void wrongPayloadArityIsRejected() {
        String json = "{\"tag\":\"binary_op\",\"meta\":{\"category\":\"arithmetic\",\"operator\":\"+\"},"
                + "\"payload\":[{\"tag\":\"variable\",\"meta\":{},\"payload\":\"x\"}]}";
        assertThrows(MetaTreeFormatException.class, () -> MetaTreeJson.readNode(json));
    }

    @Test
    void nonConformingDocumentTreeIsRejected() {
        String json = "{\"language\":\"mini\",\"metadata\":{},\"originalSource\":null,"
                + "\"tree\":{\"tag\":\"variable\",\"meta\":{},\"payload\":\"\"}}";
        assertThrows(MetaTreeFormatException.class, () -> MetaTreeJson.readDocument(json));
    }

    @Test
    void notJsonIsRejected() {
        assertThrows(MetaTreeFormatException.class, () -> MetaTreeJson.readNode("{not json"));
    }

    private static Path resource(String name) throws URISyntaxException {
        return Path.of(MetaTreeJsonTest.class.getClassLoader().getResource(name).toURI());
    }
}
