package org.example.mystery.service.game;

import org.example.mystery.model.GameCharacter;
import org.example.mystery.model.Scenario;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Prompt text for every generation call of a session.
 */
public final class MysteryPrompts {

    private MysteryPrompts() {
    }

    public static String roster(String environment, int rosterSize) {
        return """
            Design the cast of a murder mystery set in this environment:
            %s

            Create exactly %d characters that belong in this setting.
            - Exactly one character has the role "Killer".
            - Exactly one character has the role "Victim".
            - Every other character has the role "Suspect" and can be questioned by the detective.
            - Give each character a distinct full name.
            - Each backstory covers their occupation, their connection to the victim,
              what they were doing that day, and anything they want to hide.
            - Give at least two suspects a plausible motive so the killer is not obvious.

            Return valid JSON only, no markdown.

            JSON SCHEMA:
            {
              "characters": [
                {"role": "Killer | Victim | Suspect", "name": "string", "backstory": "string"}
              ]
            }
            """.formatted(environment, rosterSize);
    }

    public static String scenario(String environment, List<GameCharacter> roster) {
        String cast = roster.stream()
                .map(GameCharacter::persona)
                .collect(Collectors.joining("\n"));
        return """
            Write the crime at the centre of a murder mystery.

            ENVIRONMENT:
            %s

            CHARACTERS:
            %s

            Describe where and how the victim was found, the approximate time of death,
            the weapon and the medical cause of death, and the state of the scene.
            Add witness statements or last sightings, and clues: some that point to the killer,
            some red herrings. The character brief summarises how every character relates to
            the victim and to each other. Never reveal or hint at who the killer is.
            The victim must be the character whose role is Victim.

            Return valid JSON only, no markdown.

            JSON SCHEMA:
            {
              "victimName": "string",
              "timeOfDeath": "string",
              "locationFound": "string",
              "murderWeapon": "string",
              "causeOfDeath": "string",
              "crimeSceneDetails": "string",
              "witnesses": "string",
              "initialClues": "string",
              "characterBrief": "string"
            }
            """.formatted(environment, cast);
    }

    public static String narration(Scenario scenario) {
        return """
            You are Dr. John Watson. Sherlock Holmes has just arrived at the scene of a murder.
            In no more than 100 words, brief him on what you found. Speak to him directly,
            in a conversational tone.

            %s""".formatted(crimeDetails(scenario));
    }

    public static String introduction(GameCharacter character, Scenario scenario) {
        return """
            You are this character:
            %s
            Sherlock Holmes is about to question you about a death.
            - Victim: %s
            - Time of death: %s
            - Location: %s

            Greet Holmes and introduce yourself in a few sentences, speaking to him directly.
            Do not reveal your role and do not incriminate yourself.""".formatted(
                character.persona(),
                scenario.victimName(),
                scenario.timeOfDeath(),
                scenario.locationFound());
    }

    public static String detectiveQuestion(GameCharacter character, Scenario scenario) {
        return """
            You are Sherlock Holmes, questioning %s about the murder of %s.

            %s

            Initial clues: %s

            Using the conversation so far, ask %s the single most useful next question.
            Phrase it as Holmes would. Return the question only.""".formatted(
                character.name(),
                scenario.victimName(),
                crimeDetails(scenario),
                scenario.initialClues(),
                character.name());
    }

    public static String answer(GameCharacter character, Scenario scenario, String background, String question) {
        return """
            You are this character, being questioned by Sherlock Holmes:
            Name: %s
            Role: %s

            WHAT YOU KNOW ABOUT YOURSELF:
            %s

            %s

            How the characters relate:
            %s

            Answer as the character would, from their personality, knowledge and motives.
            Only reveal what this character would know. Stay consistent with the story.
            You may lie if the character has a reason to.

            Question: %s""".formatted(
                character.name(),
                character.role().label(),
                background,
                crimeDetails(scenario),
                scenario.characterBrief(),
                question);
    }

    private static String crimeDetails(Scenario scenario) {
        return new StringBuilder("CRIME DETAILS:\n")
                .append("- Victim: ").append(scenario.victimName()).append('\n')
                .append("- Time of death: ").append(scenario.timeOfDeath()).append('\n')
                .append("- Location: ").append(scenario.locationFound()).append('\n')
                .append("- Weapon: ").append(scenario.murderWeapon()).append('\n')
                .append("- Cause of death: ").append(scenario.causeOfDeath()).append('\n')
                .append("- Scene: ").append(scenario.crimeSceneDetails()).append('\n')
                .toString();
    }
}
