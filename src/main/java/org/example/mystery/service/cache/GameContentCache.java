package org.example.mystery.service.cache;

import org.example.mystery.model.GameCharacter;
import org.example.mystery.model.Scenario;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Typed access to the shared content cache. Keys are derived from the character and the
 * scenario only, never from turn counts, so revisiting a character with the same scenario
 * hits the cache.
 */
public class GameContentCache {

    private static final Logger log = LoggerFactory.getLogger(GameContentCache.class);

    private static final String INTRO_PREFIX = "intro:";
    private static final String NARRATION_PREFIX = "narration:";

    private final CacheStore<String> store;

    public GameContentCache(CacheStore<String> store) {
        this.store = store;
    }

    public Optional<String> findIntroduction(GameCharacter character, Scenario scenario) {
        Optional<String> cached = store.get(introKey(character, scenario));
        if (cached.isPresent()) {
            log.debug("Introduction cache hit for '{}'", character.name());
        }
        return cached;
    }

    public void putIntroduction(GameCharacter character, Scenario scenario, String introduction) {
        store.set(introKey(character, scenario), introduction);
    }

    public String narration(String environment, Scenario scenario, Supplier<String> generate) {
        return store.getOrCompute(narrationKey(environment, scenario), generate, null);
    }

    /**
     * Drops every cached item that belongs to the named character.
     */
    public int invalidateCharacter(String characterName) {
        String marker = ":" + normalize(characterName) + "|";
        int removed = store.invalidateMatching(key -> key.startsWith(INTRO_PREFIX) && key.contains(marker));
        if (removed > 0) {
            log.info("Invalidated {} cached entries for '{}'", removed, characterName);
        }
        return removed;
    }

    public CacheStats stats() {
        return store.stats();
    }

    public int cleanupExpired() {
        return store.cleanupExpired();
    }

    public void clear() {
        store.clear();
    }

    static String introKey(GameCharacter character, Scenario scenario) {
        return INTRO_PREFIX + normalize(character.name()) + "|" + normalize(scenario.victimName());
    }

    static String narrationKey(String environment, Scenario scenario) {
        return NARRATION_PREFIX + normalize(environment) + "|" + normalize(scenario.victimName())
                + "|" + normalize(scenario.locationFound());
    }

    private static String normalize(String value) {
        return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    }
}
