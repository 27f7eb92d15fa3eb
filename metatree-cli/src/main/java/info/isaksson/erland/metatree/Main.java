package info.isaksson.erland.metatree;

import info.isaksson.erland.metatree.binding.MetaTreeException;
import info.isaksson.erland.metatree.core.CorpusOptions;
import info.isaksson.erland.metatree.core.CorpusProcessor;
import info.isaksson.erland.metatree.core.CorpusResult;
import info.isaksson.erland.metatree.core.MetaTreeBuilder;
import info.isaksson.erland.metatree.ir.Document;
import info.isaksson.erland.metatree.ir.MetaTreeJson;
import info.isaksson.erland.metatree.ir.Tier;
import info.isaksson.erland.metatree.validate.ValidationException;
import info.isaksson.erland.metatree.validate.ValidationLimits;
import info.isaksson.erland.metatree.validate.ValidationMode;
import info.isaksson.erland.metatree.validate.ValidationReport;
import info.isaksson.erland.metatree.validate.Validator;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Command line entry point.
 *
 * <p>Exit codes: 0 success, 1 usage error, 2 I/O or pipeline failure, 3 validation failure.</p>
 */
public final class Main {

    static final int OK = 0;
    static final int USAGE = 1;
    static final int FAILURE = 2;
    static final int INVALID = 3;

    private Main() {
    }

    public static void main(String[] args) {
        System.exit(run(args));
    }

    /**
     * Testable entrypoint that returns an exit code instead of calling System.exit.
     */
    public static int run(String[] args) {
        CliArgs parsed;
        try {
            parsed = CliArgs.parse(args);
        } catch (IllegalArgumentException ex) {
            System.err.println("Error: " + ex.getMessage());
            System.err.println();
            CliArgs.printHelp();
            return USAGE;
        }

        if (parsed.help) {
            CliArgs.printHelp();
            return OK;
        }
        if (parsed.command == null || parsed.path == null) {
            System.err.println("Error: a command and a path are required.");
            System.err.println();
            CliArgs.printHelp();
            return USAGE;
        }

        if (parsed.verbose) {
            enableVerboseLogging();
        }

        final Path path = Paths.get(parsed.path).toAbsolutePath().normalize();
        if (!Files.exists(path)) {
            System.err.println("Error: path does not exist: " + path);
            return USAGE;
        }

        MetaTreeBuilder builder = MetaTreeBuilder.withInstalledBindings();
        try {
            switch (parsed.command) {
                case "inspect":
                    return emit(MetaTreeJson.toJsonString(load(builder, path, parsed)), parsed);
                case "validate":
                    return validate(builder, path, parsed);
                case "translate": {
                    Document doc = load(builder, path, parsed);
                    String target = parsed.to != null ? parsed.to : doc.language();
                    return emit(builder.toSource(doc, target), parsed);
                }
                case "round-trip":
                    return roundTrip(builder, path, parsed);
                case "scan":
                    return scan(builder, path, parsed);
                default:
                    throw new IllegalStateException("Unhandled command " + parsed.command);
            }
        } catch (ValidationException e) {
            System.err.println("Validation failed: " + e.getMessage());
            return INVALID;
        } catch (MetaTreeException e) {
            System.err.println("Error: " + e.getClass().getSimpleName() + ": " + e.getMessage());
            return FAILURE;
        } catch (IOException e) {
            System.err.println("Error: could not read or write " + path);
            System.err.println(e.getMessage());
            return FAILURE;
        }
    }

    private static int validate(MetaTreeBuilder builder, Path path, CliArgs parsed)
            throws MetaTreeException, IOException {
        Document doc = load(builder, path, parsed);
        ValidationLimits limits = ValidationLimits.DEFAULTS;
        if (parsed.maxDepth != null) limits = limits.withMaxDepth(parsed.maxDepth);
        if (parsed.maxNodes != null) limits = limits.withMaxNodeCount(parsed.maxNodes);
        if (parsed.maxVariables != null) limits = limits.withMaxVariables(parsed.maxVariables);

        ValidationReport report = new Validator().validate(doc, parsed.mode, limits);
        return emit(report.toJsonString(), parsed);
    }

    private static int roundTrip(MetaTreeBuilder builder, Path path, CliArgs parsed)
            throws MetaTreeException, IOException {
        String language = parsed.language != null ? parsed.language : builder.detect(path);
        String source = Files.readString(path, StandardCharsets.UTF_8);
        String regenerated = builder.roundTrip(source, language);
        boolean equivalent = Document.equivalent(builder.fromSource(source, language),
                builder.fromSource(regenerated, language));
        if (!equivalent) {
            System.err.println("Round trip changed the structure of " + path);
            return FAILURE;
        }
        return emit(regenerated, parsed);
    }

    private static int scan(MetaTreeBuilder builder, Path root, CliArgs parsed) throws IOException {
        CorpusOptions options = new CorpusOptions();
        options.excludeGlobs.addAll(parsed.excludes);
        if (parsed.language != null) options.languages.add(parsed.language);
        if (parsed.threads != null) options.threads = parsed.threads;

        CorpusResult result = new CorpusProcessor(builder).process(root, options);

        Map<Tier, Integer> byLevel = new EnumMap<>(Tier.class);
        for (CorpusResult.Entry e : result.documents) {
            byLevel.merge(e.document().level(), 1, Integer::sum);
        }
        StringBuilder sb = new StringBuilder();
        sb.append("metatree scan\n");
        sb.append("- Root: ").append(root).append("\n");
        sb.append("- Files: ").append(result.fileCount()).append("\n");
        sb.append("- Documents: ").append(result.documents.size()).append("\n");
        for (Map.Entry<Tier, Integer> e : byLevel.entrySet()) {
            sb.append("  - ").append(e.getKey().name().toLowerCase(Locale.ROOT)).append(": ")
                    .append(e.getValue()).append("\n");
        }
        sb.append("- Failures: ").append(result.failures.size());
        for (CorpusResult.Failure f : result.failures) {
            sb.append("\n  - ").append(f.path()).append(" (").append(f.errorType()).append("): ").append(f.message());
        }
        int code = emit(sb.toString(), parsed);
        return code == OK && result.hasFailures() ? FAILURE : code;
    }

    private static Document load(MetaTreeBuilder builder, Path path, CliArgs parsed)
            throws MetaTreeException, IOException {
        if (parsed.language == null && path.getFileName().toString().endsWith(".json")) {
            return MetaTreeJson.read(path);
        }
        return parsed.language != null ? builder.fromFile(path, parsed.language) : builder.fromFile(path);
    }

    private static int emit(String text, CliArgs parsed) throws IOException {
        if (parsed.output == null) {
            System.out.println(text);
            return OK;
        }
        Path out = Paths.get(parsed.output).toAbsolutePath().normalize();
        if (out.getParent() != null) {
            Files.createDirectories(out.getParent());
        }
        Files.writeString(out, text, StandardCharsets.UTF_8);
        return OK;
    }

    private static void enableVerboseLogging() {
        Logger root = Logger.getLogger("");
        root.setLevel(Level.FINE);
        for (Handler h : root.getHandlers()) {
            h.setLevel(Level.FINE);
        }
    }

    /** Minimal CLI argument parsing without external dependencies. */
    static final class CliArgs {
        boolean help = false;
        String command;
        String path;

        String language;
        String to;
        String output;
        boolean verbose = false;

        // validate
        ValidationMode mode = ValidationMode.STANDARD;
        Integer maxDepth;
        Integer maxNodes;
        Integer maxVariables;

        // scan
        Integer threads;
        final List<String> excludes = new ArrayList<>();

        private static final List<String> COMMANDS = List.of("inspect", "validate", "translate", "round-trip", "scan");

        static CliArgs parse(String[] args) {
            CliArgs out = new CliArgs();

            for (int i = 0; i < args.length; i++) {
                String a = args[i];
                if (a == null) continue;

                // support --exclude=glob
                if (a.startsWith("--exclude=")) {
                    out.excludes.add(a.substring("--exclude=".length()));
                    continue;
                }

                switch (a) {
                    case "--help":
                    case "-h":
                        out.help = true;
                        break;
                    case "--language":
                        out.language = requireValue(args, ++i, "--language");
                        break;
                    case "--to":
                        out.to = requireValue(args, ++i, "--to");
                        break;
                    case "--output":
                        out.output = requireValue(args, ++i, "--output");
                        break;
                    case "--mode":
                        out.mode = parseMode(requireValue(args, ++i, "--mode"));
                        break;
                    case "--max-depth":
                        out.maxDepth = parsePositive(requireValue(args, ++i, "--max-depth"), "--max-depth");
                        break;
                    case "--max-nodes":
                        out.maxNodes = parsePositive(requireValue(args, ++i, "--max-nodes"), "--max-nodes");
                        break;
                    case "--max-variables":
                        out.maxVariables = parsePositive(requireValue(args, ++i, "--max-variables"), "--max-variables");
                        break;
                    case "--threads":
                        out.threads = parsePositive(requireValue(args, ++i, "--threads"), "--threads");
                        break;
                    case "--exclude":
                        out.excludes.add(requireValue(args, ++i, "--exclude"));
                        break;
                    case "--verbose":
                    case "-v":
                        out.verbose = true;
                        break;
                    default:
                        if (a.startsWith("--")) {
                            throw new IllegalArgumentException("Unknown argument: " + a);
                        }
                        if (out.command == null) {
                            if (!COMMANDS.contains(a)) {
                                throw new IllegalArgumentException("Unknown command: " + a);
                            }
                            out.command = a;
                        } else if (out.path == null) {
                            out.path = a;
                        } else {
                            throw new IllegalArgumentException("Unexpected extra argument: " + a);
                        }
                }
            }

            return out;
        }

        static String requireValue(String[] args, int index, String flag) {
            if (index >= args.length) {
                throw new IllegalArgumentException("Missing value for " + flag);
            }
            String v = args[index];
            if (v == null || v.isBlank() || v.startsWith("--")) {
                throw new IllegalArgumentException("Invalid value for " + flag + ": " + v);
            }
            return v;
        }

        static int parsePositive(String v, String flag) {
            try {
                int n = Integer.parseInt(v.trim());
                if (n <= 0) throw new IllegalArgumentException("Value for " + flag + " must be positive: " + v);
                return n;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid number for " + flag + ": " + v);
            }
        }

        static ValidationMode parseMode(String v) {
            return ValidationMode.fromWire(v.trim().toLowerCase(Locale.ROOT));
        }

        static void printHelp() {
            System.out.println(
                    "metatree\n" +
                    "\n" +
                    "Usage:\n" +
                    "  java -jar metatree-cli.jar <command> <path> [options]\n" +
                    "\n" +
                    "Commands:\n" +
                    "  inspect <file>         Print the document (meta-tree JSON) for a source file\n" +
                    "  validate <file>        Validate a source file or a document JSON and print the report\n" +
                    "  translate <file>       Regenerate source, optionally in another language (--to)\n" +
                    "  round-trip <file>      Parse, abstract, reify and unparse; fails if the structure changes\n" +
                    "  scan <dir>             Build documents for every recognised file and print a summary\n" +
                    "\n" +
                    "Options:\n" +
                    "  --language <tag>       Source language (default: detected from the file extension)\n" +
                    "  --to <tag>             Target language for translate (default: the source language)\n" +
                    "  --output <file>        Write the result to a file instead of stdout\n" +
                    "  --mode <mode>          Validation mode: strict | standard | permissive (default: standard)\n" +
                    "  --max-depth <n>        Maximum tree depth (default: " + ValidationLimits.DEFAULT_MAX_DEPTH + ")\n" +
                    "  --max-nodes <n>        Maximum node count (default: " + ValidationLimits.DEFAULT_MAX_NODE_COUNT + ")\n" +
                    "  --max-variables <n>    Maximum distinct variables (default: " + ValidationLimits.DEFAULT_MAX_VARIABLES + ")\n" +
                    "  --exclude <glob>       Exclude paths matching glob during scan (repeatable). Matches are\n" +
                    "                         evaluated against paths relative to <dir> using '/' separators.\n" +
                    "                         Also supports --exclude=<glob>.\n" +
                    "  --threads <n>          Worker threads for scan (default: available processors)\n" +
                    "  -v, --verbose          Log pipeline details\n" +
                    "  -h, --help             Show help\n" +
                    "\n" +
                    "Exit codes: 0 ok, 1 usage error, 2 I/O or pipeline failure, 3 validation failure\n" +
                    "\n" +
                    "Examples:\n" +
                    "  java -jar metatree-cli.jar inspect src/main/java/demo/Cart.java\n" +
                    "  java -jar metatree-cli.jar validate Cart.java --mode strict --max-depth 200\n" +
                    "  java -jar metatree-cli.jar scan . --exclude \"**/generated/**\"\n"
            );
        }
    }
}
