package org.example.mystery.config;

import org.example.mystery.service.cache.CacheStore;
import org.example.mystery.service.cache.GameContentCache;
import org.example.mystery.service.context.ContextIndex;
import org.example.mystery.service.context.LuceneSimilarityBackend;
import org.example.mystery.service.context.TextChunker;
import org.example.mystery.service.game.ConversationMachine;
import org.example.mystery.service.game.SessionMachine;
import org.example.mystery.service.llm.GenerationBackend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Process-wide cache, context index and the two investigation machines built on them.
 */
@Configuration
public class MysteryComponentsConfig {

    private static final Logger log = LoggerFactory.getLogger(MysteryComponentsConfig.class);

    @Value("${mystery.cache.max-size:200}")
    private int cacheMaxSize;

    @Value("${mystery.cache.ttl-seconds:7200}")
    private long cacheTtlSeconds;

    @Value("${mystery.context.chunk-size:500}")
    private int chunkSize;

    @Value("${mystery.context.chunk-overlap:50}")
    private int chunkOverlap;

    @Value("${mystery.context.max-chunks:3}")
    private int maxChunks;

    @Value("${mystery.context.similarity.enabled:true}")
    private boolean similarityEnabled;

    @Value("${mystery.context.answer-max-tokens:300}")
    private int answerMaxTokens;

    @Value("${mystery.conversation.max-turns:20}")
    private int maxTurns;

    @Value("${mystery.conversation.exit-token:EXIT}")
    private String exitToken;

    @Bean
    public GameContentCache gameContentCache() {
        log.info("Content cache: maxSize={}, ttl={}s", cacheMaxSize, cacheTtlSeconds);
        return new GameContentCache(new CacheStore<>(cacheMaxSize, Duration.ofSeconds(cacheTtlSeconds)));
    }

    @Bean
    public ContextIndex contextIndex() {
        return new ContextIndex(
                new TextChunker(chunkSize, chunkOverlap),
                maxChunks,
                similarityEnabled ? new LuceneSimilarityBackend() : null);
    }

    @Bean
    public ConversationMachine conversationMachine(GenerationBackend generationBackend,
                                                   GameContentCache gameContentCache,
                                                   ContextIndex contextIndex) {
        return new ConversationMachine(generationBackend, gameContentCache, contextIndex,
                maxTurns, exitToken, answerMaxTokens);
    }

    @Bean
    public SessionMachine sessionMachine(GenerationBackend generationBackend,
                                         ConversationMachine conversationMachine,
                                         ContextIndex contextIndex,
                                         GameContentCache gameContentCache) {
        return new SessionMachine(generationBackend, conversationMachine, contextIndex, gameContentCache);
    }
}
