package info.isaksson.erland.metatree.process;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Typed request/response exchange with an out-of-process parser or printer.
 *
 * <p>The command is an argument vector started without a shell. One JSON request
 * {@code {"operation": ..., "payload": ...}} is written to stdin, then stdin is closed. The tool
 * answers on stdout with either</p>
 * <pre>
 * {"ok": true,  "result": ...}
 * {"ok": false, "error": {"type": ..., "message": ..., "line": ...}}
 * </pre>
 * <p>Every other outcome (non-zero exit, timeout, unparsable output, failure to start) becomes a
 * {@link ToolFailure} as well, so callers only deal with one failure type.</p>
 */
public final class ExternalToolExchange {

    private static final Logger LOG = Logger.getLogger(ExternalToolExchange.class.getName());
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final int STDERR_EXCERPT = 2000;

    private static final ExecutorService STREAM_READERS = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "metatree-tool-io");
        t.setDaemon(true);
        return t;
    });

    private final List<String> command;
    private final Duration timeout;

    public ExternalToolExchange(List<String> command, Duration timeout) {
        if (command == null || command.isEmpty()) throw new IllegalArgumentException("command is empty");
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        this.command = List.copyOf(command);
        this.timeout = timeout;
    }

    public List<String> command() {
        return command;
    }

    public Duration timeout() {
        return timeout;
    }

    /** Runs one request and returns the {@code result} value of a successful response. */
    public JsonNode call(String operation, JsonNode payload) throws ToolFailureException {
        ObjectNode request = MAPPER.createObjectNode();
        request.put("operation", operation);
        request.set("payload", payload == null ? NullNode.getInstance() : payload);
        byte[] requestBytes;
        try {
            requestBytes = MAPPER.writeValueAsBytes(request);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("payload is not serializable", e);
        }

        long started = System.nanoTime();
        LOG.fine(() -> "Starting " + command + " for '" + operation + "'");

        Process process;
        try {
            process = new ProcessBuilder(command).start();
        } catch (IOException e) {
            throw new ToolFailureException(ToolFailure.of(ToolFailure.Kind.LAUNCH_FAILED,
                    "cannot start " + command.get(0) + ": " + e.getMessage()), e);
        }

        CompletableFuture<String> stdout = readAsync(process.getInputStream());
        CompletableFuture<String> stderr = readAsync(process.getErrorStream());
        writeAsync(process.getOutputStream(), requestBytes);

        try {
            // The request is written while we wait, so a tool that never reads stdin still times out.
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new ToolFailureException(ToolFailure.of(ToolFailure.Kind.TIMEOUT,
                        command.get(0) + " did not answer within " + timeout.toMillis() + " ms"));
            }
            String out = stdout.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            int exit = process.exitValue();
            LOG.fine(() -> command.get(0) + " exited " + exit + " after "
                    + TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started) + " ms");
            if (exit != 0) {
                String err = excerpt(stderr.get(timeout.toMillis(), TimeUnit.MILLISECONDS));
                throw new ToolFailureException(ToolFailure.of(ToolFailure.Kind.NON_ZERO_EXIT,
                        command.get(0) + " exited with status " + exit + (err.isEmpty() ? "" : ": " + err)));
            }
            return parseResponse(out);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new ToolFailureException(ToolFailure.of(ToolFailure.Kind.INTERRUPTED, "interrupted"), e);
        } catch (ExecutionException | TimeoutException e) {
            process.destroyForcibly();
            throw new ToolFailureException(ToolFailure.of(ToolFailure.Kind.MALFORMED_OUTPUT,
                    "cannot read tool output: " + e.getMessage()), e);
        }
    }

    static JsonNode parseResponse(String out) throws ToolFailureException {
        JsonNode response;
        try {
            response = MAPPER.readTree(out == null ? "" : out);
        } catch (JsonProcessingException e) {
            throw new ToolFailureException(ToolFailure.of(ToolFailure.Kind.MALFORMED_OUTPUT,
                    "response is not JSON: " + e.getOriginalMessage()), e);
        }
        if (response == null || !response.isObject() || !response.path("ok").isBoolean()) {
            throw new ToolFailureException(ToolFailure.of(ToolFailure.Kind.MALFORMED_OUTPUT,
                    "response lacks a boolean 'ok' field"));
        }
        if (response.get("ok").booleanValue()) {
            return response.has("result") ? response.get("result") : NullNode.getInstance();
        }
        JsonNode error = response.path("error");
        if (!error.isObject()) {
            throw new ToolFailureException(ToolFailure.of(ToolFailure.Kind.MALFORMED_OUTPUT,
                    "failed response lacks an 'error' object"));
        }
        throw new ToolFailureException(new ToolFailure(ToolFailure.Kind.TOOL_ERROR,
                error.path("type").asText(null), error.path("message").asText(""), error.path("line").asInt(0)));
    }

    private static CompletableFuture<Void> writeAsync(OutputStream stream, byte[] bytes) {
        return CompletableFuture.runAsync(() -> {
            try (OutputStream out = stream) {
                out.write(bytes);
            } catch (IOException e) {
                // The tool may exit without reading its input; the exit status decides.
                LOG.log(Level.FINE, "Tool closed stdin early", e);
            }
        }, STREAM_READERS);
    }

    private static CompletableFuture<String> readAsync(InputStream stream) {
        return CompletableFuture.supplyAsync(() -> {
            try (InputStream in = stream) {
                return new String(in.readAllBytes(), StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }, STREAM_READERS);
    }

    private static String excerpt(String s) {
        String t = s == null ? "" : s.strip();
        return t.length() <= STDERR_EXCERPT ? t : t.substring(0, STDERR_EXCERPT) + "...";
    }
}
