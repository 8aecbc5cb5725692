package ru.tigran.dialoguesimulator.service;

import ru.tigran.dialoguesimulator.config.ConversationSettings;
import ru.tigran.dialoguesimulator.model.EndingReason;
import ru.tigran.dialoguesimulator.model.Turn;
import ru.tigran.dialoguesimulator.util.TextMatchUtils;

import java.util.List;
import java.util.Optional;
import java.util.Random;

/**
 * Decides whether a conversation ends after the latest turn. First match wins:
 * <ol>
 *     <li>turn count at the hard limit: {@link EndingReason#HARD_LIMIT}</li>
 *     <li>turn count at the minimum and the latest turn contains a closing phrase: {@link EndingReason#NATURAL_ENDING}</li>
 *     <li>turn count at the soft threshold and a random draw below the soft-ending probability:
 *     {@link EndingReason#SOFT_ENDING}</li>
 * </ol>
 * Rules 2 and 3 need room for the trailing acknowledgment turn below the hard limit.
 */
public class ConversationEndingPolicy {

    private final ConversationSettings settings;
    private final Random random;

    public ConversationEndingPolicy(ConversationSettings settings, Random random) {
        this.settings = settings;
        this.random = random;
    }

    public Optional<EndingReason> evaluate(List<Turn> turns) {
        int count = turns.size();
        if (count >= settings.hardLimit()) {
            return Optional.of(EndingReason.HARD_LIMIT);
        }
        // the acknowledgment turn must still fit below the hard limit
        if (count + 1 >= settings.hardLimit()) {
            return Optional.empty();
        }

        if (count >= settings.minEndingTurns() && !turns.isEmpty()) {
            String lastText = turns.get(count - 1).text();
            if (TextMatchUtils.containsAny(lastText, DialogueLexicon.CLOSING_PHRASES)) {
                return Optional.of(EndingReason.NATURAL_ENDING);
            }
        }

        if (count >= settings.softEndingTurns() && random.nextDouble() < settings.softEndingProbability()) {
            return Optional.of(EndingReason.SOFT_ENDING);
        }

        return Optional.empty();
    }
}
