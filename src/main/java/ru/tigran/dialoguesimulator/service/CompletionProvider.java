package ru.tigran.dialoguesimulator.service;

import ru.tigran.dialoguesimulator.dto.GenerationRequest;
import ru.tigran.dialoguesimulator.exception.ProviderException;
import ru.tigran.dialoguesimulator.exception.QuotaExhaustedException;

/**
 * Black-box text completion RPC.
 */
public interface CompletionProvider {

    /**
     * Generates text for a single prompt.
     *
     * @param request model, prompt and sampling parameters
     * @return generated text, never blank
     * @throws QuotaExhaustedException when the provider reports quota exhaustion; the payload carries the retry hint
     * @throws ProviderException on any other provider failure
     */
    String generate(GenerationRequest request);
}
