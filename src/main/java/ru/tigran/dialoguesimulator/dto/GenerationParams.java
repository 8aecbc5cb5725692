package ru.tigran.dialoguesimulator.dto;

/**
 * Sampling parameters passed to the completion provider.
 * A null topK leaves the provider default in place.
 */
public record GenerationParams(
        double temperature,
        double topP,
        Integer topK,
        int maxOutputTokens,
        boolean searchGrounding
) {
    public static GenerationParams of(double temperature, double topP, int maxOutputTokens) {
        return new GenerationParams(temperature, topP, null, maxOutputTokens, false);
    }
}
