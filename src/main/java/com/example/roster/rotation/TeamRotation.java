package com.example.roster.rotation;

public record TeamRotation(String teamId, int daysOnBase, int daysAtHome) {

    public RotationConfig toConfig() {
        return new RotationConfig(daysOnBase, daysAtHome);
    }
}
