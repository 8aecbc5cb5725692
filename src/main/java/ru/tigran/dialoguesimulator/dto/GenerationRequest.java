package ru.tigran.dialoguesimulator.dto;

public record GenerationRequest(
        String model,
        String prompt,
        GenerationParams params
) {
}
