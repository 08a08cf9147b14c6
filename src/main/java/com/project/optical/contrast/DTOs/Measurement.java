package com.project.optical.contrast.DTOs;

public record Measurement(
        String name,
        SampleChain chain,
        int width,
        ContrastProfile profile
) {
    public Measurement withName(String newName) {
        return new Measurement(newName, chain, width, profile);
    }
}
