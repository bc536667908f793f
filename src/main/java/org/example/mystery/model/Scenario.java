package org.example.mystery.model;

public record Scenario(
    String victimName,
    String timeOfDeath,
    String locationFound,
    String murderWeapon,
    String causeOfDeath,
    String crimeSceneDetails,
    String witnesses,
    String initialClues,
    String characterBrief
) {
}
