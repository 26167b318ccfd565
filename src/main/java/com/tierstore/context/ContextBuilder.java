package com.tierstore.context;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tierstore.error.ResourceNotFoundException;
import com.tierstore.model.ModelGateway;
import com.tierstore.model.ModelInput;
import com.tierstore.model.Summary;
import com.tierstore.model.SummaryRequest;
import com.tierstore.model.TokenEstimator;

/**
 * Derives L0/L1/L2 for a resource. Content within the model context budget gets one summarize
 * call; larger content is summarized per chunk and L0 is generated over the chunk abstracts.
 */
public class ContextBuilder {
    private static final Logger log = LoggerFactory.getLogger(ContextBuilder.class);

    private final ModelGateway gateway;
    private final ContentFetcher fetcher;
    private final ContextBuilderConfig config;
    private final ContentChunker chunker;

    public ContextBuilder(ModelGateway gateway, ContentFetcher fetcher, ContextBuilderConfig config) {
        this.gateway = gateway;
        this.fetcher = fetcher;
        this.config = config;
        this.chunker = new ContentChunker(Math.min(config.chunkTokens(), config.maxContextTokens()),
                config.overlapLines());
    }

    public ContextLayers build(ResourceInput input) {
        if (input.contentType() == ContentType.IMAGE) {
            return buildImage(input);
        }
        String text = input.isInline()
                ? input.inlineText()
                : new String(fetch(input), StandardCharsets.UTF_8);
        return buildText(input, text);
    }

    private ContextLayers buildImage(ResourceInput input) {
        byte[] bytes = fetch(input);
        Summary summary = gateway.summarize(SummaryRequest.image(input.name(), bytes, input.mimeType(),
                config.abstractTokens(), config.overviewTokens()));
        return new ContextLayers(
                capAbstract(summary.abstractText(), input),
                capOverview(summary.overview()),
                input.payloadRef(),
                List.of(),
                ModelInput.image(bytes, input.mimeType()),
                summary.model(),
                false);
    }

    private ContextLayers buildText(ResourceInput input, String text) {
        List<ContentChunk> chunks = chunker.chunk(text);
        String l2Ref = input.isInline() ? "" : input.payloadRef();
        int tokens = TokenEstimator.estimate(text);
        if (tokens <= config.maxContextTokens() || chunks.size() <= 1) {
            Summary summary = gateway.summarize(SummaryRequest.text(input.name(), text,
                    config.abstractTokens(), config.overviewTokens()));
            return new ContextLayers(capAbstract(summary.abstractText(), input), capOverview(summary.overview()),
                    l2Ref, chunks, null, summary.model(), false);
        }

        log.debug("Summarizing {} in {} chunks tokens={}", input.uri(), chunks.size(), tokens);
        int overviewShare = Math.max(config.abstractTokens(), config.overviewTokens() / chunks.size());
        List<String> abstracts = new ArrayList<>(chunks.size());
        StringBuilder overview = new StringBuilder();
        String model = gateway.summarizerModelId();
        for (ContentChunk chunk : chunks) {
            Summary part = gateway.summarize(SummaryRequest.text(input.name() + " " + chunk.anchor(), chunk.text(),
                    config.abstractTokens(), overviewShare));
            model = part.model();
            abstracts.add(part.abstractText());
            String body = part.overview() == null || part.overview().isBlank() ? part.abstractText() : part.overview();
            overview.append(chunk.anchor()).append('\n')
                    .append(TokenEstimator.truncate(body, overviewShare)).append("\n\n");
        }
        String combined = TokenEstimator.truncate(String.join("\n", abstracts), config.maxContextTokens());
        Summary top = gateway.summarize(SummaryRequest.text(input.name(), combined,
                config.abstractTokens(), config.abstractTokens()));
        return new ContextLayers(capAbstract(top.abstractText(), input), capOverview(overview.toString()),
                l2Ref, chunks, null, model, true);
    }

    private byte[] fetch(ResourceInput input) {
        try {
            return fetcher.fetchBytes(input.payloadRef());
        } catch (IOException e) {
            throw new ResourceNotFoundException(input.uri(),
                    "payload " + input.payloadRef() + " unavailable: " + e.getMessage(), e);
        }
    }

    private String capAbstract(String text, ResourceInput input) {
        String capped = TokenEstimator.truncate(text, config.abstractTokens());
        return capped.isBlank() ? input.name() : capped;
    }

    private String capOverview(String text) {
        return TokenEstimator.truncate(text, config.overviewTokens());
    }
}
