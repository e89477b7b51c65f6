package dev.pairreview.analysis.voice;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.pairreview.config.AnalysisProperties;
import dev.pairreview.config.VoiceProperties;
import dev.pairreview.config.VoiceProperties.ProviderCommand;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Runs a voice as a provider CLI subprocess.
 *
 * <p>The prompt goes to stdin. Stdout is read line by line: stream-JSON lines
 * ({@code {"type":"assistant",...}}, {@code {"type":"result","result":"..."}}) are turned into
 * events and the final result text; any other line is plain response text. The process is killed
 * when it exceeds the configured timeout.
 */
@Component
public class CliVoiceRunner implements VoiceRunner {

    private static final Logger log = LoggerFactory.getLogger(CliVoiceRunner.class);
    private static final int STDERR_TAIL = 2_000;

    private final VoiceProperties voiceProperties;
    private final VoiceOutputParser parser;
    private final ObjectMapper objectMapper;
    private final Duration timeout;
    private final Executor ioExecutor;

    public CliVoiceRunner(VoiceProperties voiceProperties, VoiceOutputParser parser, ObjectMapper objectMapper,
                          AnalysisProperties analysisProperties,
                          @Qualifier("processIoExecutor") Executor ioExecutor) {
        this.voiceProperties = voiceProperties;
        this.parser = parser;
        this.objectMapper = objectMapper;
        this.timeout = analysisProperties.voiceTimeout();
        this.ioExecutor = ioExecutor;
    }

    @Override
    @CircuitBreaker(name = "voice-cli", fallbackMethod = "circuitOpen")
    public VoiceResponse invoke(VoiceRequest request, VoiceEventListener listener) {
        String voiceKey = request.voice().key();
        ProviderCommand provider = voiceProperties.providers().get(request.voice().provider());
        if (provider == null) {
            throw new VoiceInvocationException(voiceKey, "Unknown provider: " + request.voice().provider());
        }

        List<String> commandLine = provider.commandLine(request.voice().model());
        log.info("[{}] Running {} ({} prompt chars)", request.promptType(), voiceKey, request.prompt().length());
        Instant start = Instant.now();

        Process process;
        try {
            ProcessBuilder builder = new ProcessBuilder(commandLine)
                    .directory(request.workingDirectory().toFile());
            builder.environment().putAll(provider.env());
            process = builder.start();
        } catch (IOException e) {
            throw new VoiceInvocationException(voiceKey,
                    "Could not start %s: %s".formatted(provider.command(), e.getMessage()), e);
        }

        CompletableFuture<String> stdout;
        CompletableFuture<String> stderr;
        try {
            stdout = CompletableFuture.supplyAsync(() -> readStdout(process, listener), ioExecutor);
            stderr = CompletableFuture.supplyAsync(() -> readStderr(process), ioExecutor);
        } catch (RejectedExecutionException e) {
            process.destroyForcibly();
            throw new VoiceInvocationException(voiceKey, "No reader available for voice output", e);
        }

        try (OutputStream stdin = process.getOutputStream()) {
            stdin.write(request.prompt().getBytes(StandardCharsets.UTF_8));
        } catch (IOException e) {
            process.destroyForcibly();
            throw new VoiceInvocationException(voiceKey, "Failed to write prompt: " + e.getMessage(), e);
        }

        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new VoiceInvocationException(voiceKey, "Timed out after " + timeout);
            }
            String errors = stderr.get();
            if (process.exitValue() != 0) {
                throw new VoiceInvocationException(voiceKey,
                        "Exited with code %d: %s".formatted(process.exitValue(), tail(errors)));
            }
            if (!errors.isBlank()) {
                log.debug("[{}] {} stderr: {}", request.promptType(), voiceKey, tail(errors));
            }
            VoiceResponse response = parser.parse(voiceKey, stdout.get());
            log.info("[{}] {} returned {} suggestions in {}", request.promptType(), voiceKey,
                    response.suggestions().size(), Duration.between(start, Instant.now()));
            return response;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new VoiceInvocationException(voiceKey, "Interrupted while waiting for voice", e);
        } catch (ExecutionException e) {
            throw new VoiceInvocationException(voiceKey, "Failed to read output: " + e.getCause().getMessage(),
                    e.getCause());
        }
    }

    // ── Internal ───────────────────────────────────────────────────

    /** Only an open circuit is translated; every other failure propagates unchanged. */
    private VoiceResponse circuitOpen(VoiceRequest request, VoiceEventListener listener,
                                      CallNotPermittedException e) {
        throw new VoiceInvocationException(request.voice().key(), "Voice CLI circuit is open", e);
    }

    private String readStdout(Process process, VoiceEventListener listener) {
        StringBuilder plain = new StringBuilder();
        String result = null;
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                JsonNode event = streamEvent(line);
                if (event == null) {
                    plain.append(line).append('\n');
                    if (!line.isBlank()) listener.onEvent(VoiceEvent.text(line));
                } else if ("result".equals(event.path("type").asText())) {
                    result = event.path("result").asText(null);
                } else {
                    emitAssistantContent(event, listener);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return result != null ? result : plain.toString();
    }

    private String readStderr(Process process) {
        try {
            return new String(process.getErrorStream().readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /** Returns the parsed line when it is a stream-JSON event, null for plain text. */
    private JsonNode streamEvent(String line) {
        String trimmed = line.strip();
        if (!trimmed.startsWith("{\"type\"")) return null;
        try {
            JsonNode node = objectMapper.readTree(trimmed);
            return node.hasNonNull("type") ? node : null;
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    private void emitAssistantContent(JsonNode event, VoiceEventListener listener) {
        for (JsonNode content : event.path("message").path("content")) {
            switch (content.path("type").asText()) {
                case "text" -> listener.onEvent(VoiceEvent.text(content.path("text").asText()));
                case "tool_use" -> listener.onEvent(VoiceEvent.toolUse(content.path("name").asText("tool")));
                default -> { }
            }
        }
    }

    private static String tail(String text) {
        String stripped = text.strip();
        return stripped.length() <= STDERR_TAIL ? stripped : stripped.substring(stripped.length() - STDERR_TAIL);
    }
}
