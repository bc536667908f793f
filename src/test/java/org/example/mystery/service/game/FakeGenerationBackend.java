package org.example.mystery.service.game;

import org.example.mystery.model.CharacterRole;
import org.example.mystery.model.CharacterRoster;
import org.example.mystery.model.ChatMessage;
import org.example.mystery.model.GameCharacter;
import org.example.mystery.model.Scenario;
import org.example.mystery.service.llm.GenerationBackend;
import org.example.mystery.service.llm.GenerationFailureException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.Predicate;

/**
 * Scripted backend for the "small harbor town" case. Text replies come from a queue when one is
 * scripted, otherwise they are numbered placeholders.
 */
class FakeGenerationBackend implements GenerationBackend {

    static final GameCharacter AGNES = new GameCharacter(CharacterRole.SUSPECT, "Agnes Pike",
            "Harbour master for thirty years. She stayed late on the night of the murder to reconcile the tide tables.");
    static final GameCharacter SILAS = new GameCharacter(CharacterRole.VICTIM, "Silas Rook",
            "Moneylender who was owed by half the town.");
    static final GameCharacter TOM = new GameCharacter(CharacterRole.KILLER, "Tom Pike",
            "Agnes's nephew. He borrowed her lantern and returned it after midnight.");
    static final GameCharacter MARY = new GameCharacter(CharacterRole.SUSPECT, "Mary Dunn",
            "Runs the fish stall next to the market hall.");

    static final Scenario SCENARIO = new Scenario(
            "Silas Rook",
            "around midnight",
            "the fish market",
            "a gaff hook",
            "blood loss",
            "Scales and lamp oil on the cobbles.",
            "A night watchman saw a lantern moving near the pier.",
            "A torn page from the harbour ledger.",
            "Agnes is Tom's aunt; Mary owed Silas money.");

    CharacterRoster roster = new CharacterRoster(List.of(AGNES, SILAS, TOM, MARY));
    Scenario scenario = SCENARIO;
    Predicate<String> failWhen = prompt -> false;

    final Deque<String> scriptedText = new ArrayDeque<>();
    final List<String> textPrompts = new ArrayList<>();
    final List<List<ChatMessage>> histories = new ArrayList<>();
    int structuredCalls;

    @Override
    public String generateText(String prompt, List<ChatMessage> history) {
        textPrompts.add(prompt);
        histories.add(List.copyOf(history));
        if (failWhen.test(prompt)) {
            throw new GenerationFailureException("scripted failure");
        }
        if (!scriptedText.isEmpty()) {
            return scriptedText.poll();
        }
        return "generated " + textPrompts.size();
    }

    @Override
    public <T> T generateStructured(String prompt, Class<T> type) {
        structuredCalls++;
        if (type == CharacterRoster.class) {
            return type.cast(roster);
        }
        if (type == Scenario.class) {
            return type.cast(scenario);
        }
        throw new GenerationFailureException("Unexpected type " + type.getSimpleName());
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public String getBackendName() {
        return "fake";
    }

    long promptsContaining(String fragment) {
        return textPrompts.stream().filter(p -> p.contains(fragment)).count();
    }
}
