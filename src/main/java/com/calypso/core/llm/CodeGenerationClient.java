package com.calypso.core.llm;

import com.calypso.core.build.BuildProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;

/**
 * Wraps Spring AI's {@link ChatClient} for the two model calls a build makes: the streamed
 * full-project generation and the blocking repair call.
 * <p>
 * Either call may use its own model ({@code calypso.build.generation-model},
 * {@code calypso.build.repair-model}); blank means the provider default.
 */
@Service
public class CodeGenerationClient {

    private static final Logger log = LoggerFactory.getLogger(CodeGenerationClient.class);

    private final ChatClient chatClient;
    private final BuildProperties properties;

    public CodeGenerationClient(ChatClient.Builder builder, BuildProperties properties) {
        this.chatClient = builder.build();
        this.properties = properties;
    }

    /**
     * Streams the generation response as text deltas. Nothing is sent until subscription;
     * cancelling the subscription aborts the upstream request.
     */
    public Flux<String> streamProject(String systemPrompt, String userPrompt) {
        return Flux.defer(() -> {
            log.info("Generation stream started (system prompt {} chars)", systemPrompt.length());
            return chatClient.prompt()
                    .system(systemPrompt)
                    .user(userPrompt)
                    .options(options(properties.getGenerationModel()))
                    .stream()
                    .content();
        });
    }

    /**
     * Asks for corrected files. Returns the raw response text, empty when the model
     * returned nothing.
     */
    public String requestFixes(String systemPrompt, String userPrompt) {
        log.info("Repair call started ({} chars of context)", userPrompt.length());
        long start = System.currentTimeMillis();
        String response = chatClient.prompt()
                .system(systemPrompt)
                .user(userPrompt)
                .options(options(properties.getRepairModel()))
                .call()
                .content();
        long elapsed = System.currentTimeMillis() - start;
        log.info("Repair call complete ({}s)", String.format("%.1f", elapsed / 1000.0));
        return response == null ? "" : response;
    }

    private ChatOptions options(String model) {
        var builder = ChatOptions.builder().maxTokens(properties.getMaxTokens());
        if (model != null && !model.isBlank()) {
            builder.model(model);
        }
        return builder.build();
    }
}
