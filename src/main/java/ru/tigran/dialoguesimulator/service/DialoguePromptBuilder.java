package ru.tigran.dialoguesimulator.service;

import ru.tigran.dialoguesimulator.dto.GenerationParams;
import ru.tigran.dialoguesimulator.model.ConversationPhase;
import ru.tigran.dialoguesimulator.model.Intervention;
import ru.tigran.dialoguesimulator.model.StanceSummary;
import ru.tigran.dialoguesimulator.model.SubjectProfile;
import ru.tigran.dialoguesimulator.model.Turn;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Builder for the per-turn generation prompts of both dialogue sides.
 *
 * Usage:
 * String agentPrompt = DialoguePromptBuilder.buildAgentPrompt(intervention, phase, history, stance, example);
 * String subjectPrompt = DialoguePromptBuilder.buildSubjectPrompt(profile, history, phase);
 *
 * Prompts are authored in English and always ask for Hebrew output.
 * History is passed in already trimmed to the caller's window.
 */
public class DialoguePromptBuilder {

    public static final GenerationParams AGENT_PARAMS = GenerationParams.of(0.8, 0.9, 300);
    public static final GenerationParams SUBJECT_PARAMS = GenerationParams.of(0.85, 0.9, 250);

    /**
     * Builds the agent prompt.
     *
     * Sections: intervention template, phase guidance (with an example closing line in closing phases),
     * recent history, stance summary of the subject, output instructions.
     *
     * @param intervention strategy carried by the agent
     * @param phase current conversation phase
     * @param history recent turns, oldest first
     * @param stance stance summary of the subject
     * @param exampleLine example phrasing for the phase, null when the phase has none
     * @return prompt text
     */
    public static String buildAgentPrompt(Intervention intervention,
                                          ConversationPhase phase,
                                          List<Turn> history,
                                          StanceSummary stance,
                                          String exampleLine) {
        StringBuilder prompt = new StringBuilder();
        prompt.append(intervention.getTemplate().strip()).append("\n\n");

        prompt.append("Current conversation phase: ").append(phase.getValue()).append("\n");
        prompt.append(phase.getAgentInstruction()).append("\n");
        if (exampleLine != null && !exampleLine.isBlank()) {
            prompt.append("Example of a fitting line for this phase: \"").append(exampleLine).append("\"\n");
        }
        prompt.append("\n");

        prompt.append("Conversation so far:\n");
        prompt.append(renderHistory(history)).append("\n\n");

        prompt.append("User profile context:\n");
        prompt.append("- Political stance: ").append(stance.politicalLabel()).append("\n");
        prompt.append("- Prioritizes: ").append(stance.priorityLabel()).append("\n");
        prompt.append("- Prefers: ").append(stance.preferenceLabel()).append("\n\n");

        prompt.append("IMPORTANT: You must present the OPPOSITE view from theirs while building bridges.\n\n");
        prompt.append("Generate the next agent response in Hebrew. Keep it natural and conversational.\n");
        prompt.append("Response should be 2-4 sentences maximum.\n");
        return prompt.toString();
    }

    /**
     * Builds the subject prompt from persona attributes and the short recent history.
     * In wind-down phases the subject is told it may acknowledge that the conversation is closing.
     *
     * @param profile subject persona
     * @param history recent turns, oldest first
     * @param phase current conversation phase
     * @return prompt text
     */
    public static String buildSubjectPrompt(SubjectProfile profile, List<Turn> history, ConversationPhase phase) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("You are playing the role of an Israeli with these characteristics:\n");
        prompt.append("- Age: ").append(profile.age()).append("\n");
        prompt.append("- Gender: ").append(profile.gender()).append("\n");
        prompt.append("- Political stance: ").append(profile.politicalStance()).append(" (1=left, 5=right)\n");
        prompt.append("- War priority: ").append(profile.warPriority()).append("\n");
        prompt.append("- Preferred action: ").append(profile.israelAction()).append("\n\n");

        prompt.append("Your typical phrases: ").append(renderPhrases(profile.typicalPhrases())).append("\n\n");

        prompt.append("Recent conversation:\n");
        prompt.append(renderHistory(history)).append("\n\n");

        prompt.append("Current phase: ").append(phase.getValue()).append("\n\n");

        prompt.append("Generate your next response in Hebrew. Be consistent with your political position.\n");
        prompt.append("Keep it natural and emotional. 2-3 sentences maximum.\n");
        if (phase.isWindingDown()) {
            prompt.append("If the conversation is winding down, you can acknowledge this naturally.\n");
        }
        return prompt.toString();
    }

    /**
     * Renders turns as "Agent: ..." / "User: ..." lines.
     */
    public static String renderHistory(List<Turn> history) {
        return history.stream()
                .map(turn -> turn.role().getHistoryLabel() + ": " + turn.text())
                .collect(Collectors.joining("\n"));
    }

    private static String renderPhrases(List<String> phrases) {
        if (phrases.isEmpty()) {
            return "(none)";
        }
        return phrases.stream()
                .map(phrase -> "\"" + phrase + "\"")
                .collect(Collectors.joining(", ", "[", "]"));
    }
}
