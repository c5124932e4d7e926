package org.example.blueprint.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import jakarta.annotation.PreDestroy;
import org.example.blueprint.model.BatchConfigSnapshot;
import org.example.blueprint.service.llm.LlmOptions;
import org.example.blueprint.service.llm.LlmProvider;
import org.example.blueprint.service.llm.LlmProviderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Compiles one seed into a character draft: prompt the generation backend, write the raw output
 * into a fresh draft directory and hand that directory back as the job's result location.
 */
@Service
public class CharacterDraftJobExecutor implements GenerationJobExecutor {

    private static final Logger log = LoggerFactory.getLogger(CharacterDraftJobExecutor.class);

    static final String OUTPUT_FILE = "character.md";
    static final String SEED_FILE = "seed.txt";
    static final String METADATA_FILE = "metadata.json";

    private static final DateTimeFormatter DIR_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    private static final int MAX_SLUG_LENGTH = 40;

    static final String DEFAULT_SYSTEM_PROMPT = """
            You are a character blueprint compiler. Expand the seed into a complete character sheet:
            name, appearance, personality, backstory, motivations, speech style and an opening scene.
            Respond in Markdown with one section per asset.""";

    private final LlmProvider llmProvider;
    private final Path draftsDirectory;
    private final String systemPrompt;
    private final LlmOptions defaultOptions;
    private final long shutdownGraceSeconds;
    private final ExecutorService ioExecutor;
    private final ObjectMapper objectMapper = JsonMapper.builder()
            .findAndAddModules()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .build();

    @Autowired
    public CharacterDraftJobExecutor(
            @Qualifier("generationLlmProvider") LlmProvider llmProvider,
            @Value("${generation.drafts-dir:drafts}") String draftsDirectory,
            @Value("${generation.system-prompt-file:}") String systemPromptFile,
            @Value("${generation.temperature:0.7}") double temperature,
            @Value("${generation.max-tokens:4096}") int maxTokens,
            @Value("${batch.cli.shutdown-grace-seconds:120}") long shutdownGraceSeconds) {
        this(llmProvider, Path.of(draftsDirectory), loadSystemPrompt(systemPromptFile),
                new LlmOptions(temperature, maxTokens > 0 ? maxTokens : null, null), shutdownGraceSeconds);
    }

    CharacterDraftJobExecutor(
            LlmProvider llmProvider,
            Path draftsDirectory,
            String systemPrompt,
            LlmOptions defaultOptions,
            long shutdownGraceSeconds) {
        this.llmProvider = llmProvider;
        this.draftsDirectory = draftsDirectory;
        this.systemPrompt = systemPrompt;
        this.defaultOptions = defaultOptions;
        this.shutdownGraceSeconds = Math.max(0L, shutdownGraceSeconds);
        // Unbounded: concurrency is capped by the batch workers, so a submitted call never queues.
        this.ioExecutor = Executors.newCachedThreadPool(new DraftIoThreadFactory());
    }

    @Override
    public Future<String> execute(String input, BatchConfigSnapshot config) {
        return ioExecutor.submit(() -> compile(input, config));
    }

    /**
     * Lets in-flight calls finish and write their drafts before the context goes away.
     */
    @PreDestroy
    public void shutdown() {
        ioExecutor.shutdown();
        try {
            if (!ioExecutor.awaitTermination(shutdownGraceSeconds, TimeUnit.SECONDS)) {
                log.warn("Generation calls still running after {}s; abandoning them", shutdownGraceSeconds);
                ioExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ioExecutor.shutdownNow();
        }
    }

    String compile(String seed, BatchConfigSnapshot config) {
        String prompt = buildUserPrompt(seed, config.mode());
        LlmOptions options = defaultOptions.withModel(config.model());
        String output = llmProvider.generate(systemPrompt, prompt, options);
        if (output == null || output.isBlank()) {
            throw new LlmProviderException("Empty response from " + llmProvider.getProviderName());
        }
        if (Thread.currentThread().isInterrupted()) {
            // cancelled by the runner after its timeout
            throw new LlmProviderException("Generation call cancelled before the draft was written");
        }

        Path draftDir = draftsDirectory.resolve(
                LocalDateTime.now().format(DIR_TIMESTAMP) + "_" + slugify(seed) + "_" + Integer.toHexString(seed.hashCode()));
        try {
            Files.createDirectories(draftDir);
            Files.writeString(draftDir.resolve(OUTPUT_FILE), output, StandardCharsets.UTF_8);
            Files.writeString(draftDir.resolve(SEED_FILE), seed, StandardCharsets.UTF_8);
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("seed", seed);
            metadata.put("mode", config.mode());
            metadata.put("model", options.model());
            metadata.put("provider", llmProvider.getProviderName());
            metadata.put("created_at", LocalDateTime.now().toString());
            objectMapper.writeValue(draftDir.resolve(METADATA_FILE).toFile(), metadata);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write draft for seed '" + abbreviate(seed) + "'", e);
        }
        log.info("Saved draft for '{}' to {}", abbreviate(seed), draftDir.getFileName());
        return draftDir.toString();
    }

    static String buildUserPrompt(String seed, String mode) {
        StringBuilder prompt = new StringBuilder();
        if (mode != null && !mode.isBlank()) {
            prompt.append("Mode: ").append(mode.trim()).append('\n');
        }
        prompt.append("SEED: ").append(seed);
        return prompt.toString();
    }

    static String slugify(String seed) {
        String slug = seed.toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9]+", "_")
                .replaceAll("^_+|_+$", "");
        if (slug.length() > MAX_SLUG_LENGTH) {
            slug = slug.substring(0, MAX_SLUG_LENGTH).replaceAll("_+$", "");
        }
        return slug.isEmpty() ? "character" : slug;
    }

    private static String abbreviate(String seed) {
        return seed.length() <= 60 ? seed : seed.substring(0, 57) + "...";
    }

    private static String loadSystemPrompt(String systemPromptFile) {
        if (systemPromptFile == null || systemPromptFile.isBlank()) {
            return DEFAULT_SYSTEM_PROMPT;
        }
        try {
            return Files.readString(Path.of(systemPromptFile), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read system prompt file " + systemPromptFile, e);
        }
    }

    private static final class DraftIoThreadFactory implements ThreadFactory {
        private final AtomicInteger nextThreadId = new AtomicInteger(1);

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "draft-io-" + nextThreadId.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        }
    }
}
