package ru.tigran.dialoguesimulator.service;

import ru.tigran.dialoguesimulator.model.ConversationPhase;

import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Fixed Hebrew phrase lists used by the conversation driver.
 */
public final class DialogueLexicon {

    /**
     * Agent opening lines, one picked at random per conversation.
     */
    public static final List<String> AGENT_OPENINGS = List.of(
            "שלום, איך את/ה מרגיש/ה עם המצב בימים האלה?",
            "היי, מה דעתך על מה שקורה עכשיו עם המלחמה?",
            "שלום, איך את/ה מתמודד/ת עם כל מה שקורה?",
            "היי, איך המצב? איך את/ה עם כל מה שקורה בעזה?",
            "שלום, מה עובר עליך בתקופה הקשה הזאת?"
    );

    /**
     * Closing phrases that end a conversation naturally once the minimum length is reached.
     */
    public static final List<String> CLOSING_PHRASES = List.of(
            "תודה על השיחה",
            "היה מעניין",
            "נחמד שדיברנו",
            "אני צריך ללכת",
            "בוא נסיים",
            "נסכים שלא נסכים"
    );

    /**
     * Subject acknowledgments appended after a non-hard-limit ending.
     */
    public static final List<String> SUBJECT_CLOSINGS = List.of(
            "תודה על השיחה",
            "היה מעניין לשמוע אותך",
            "נתת לי על מה לחשוב",
            "טוב, נחמד שדיברנו",
            "אני צריך לעכל את זה"
    );

    /**
     * Example agent lines nudging the dialogue towards a close, per closing phase.
     */
    public static final Map<ConversationPhase, List<String>> ENDING_PROGRESSIONS = Map.of(
            ConversationPhase.PRE_CLOSURE, List.of(
                    "אז בעצם מה שאתה אומר זה...",
                    "אם אני מבין נכון, הדאגה העיקרית שלך היא...",
                    "זה מעניין שאנחנו מסכימים על..."
            ),
            ConversationPhase.SOFT_CLOSURE, List.of(
                    "נראה לי שהגענו לכמה נקודות חשובות...",
                    "אני חושב שכיסינו הרבה בשיחה הזאת...",
                    "זה היה חשוב לשמוע את הזווית שלך..."
            ),
            ConversationPhase.CLOSURE, List.of(
                    "תודה על השיחה הפתוחה, גם אם אנחנו לא מסכימים על הכל...",
                    "היה לי חשוב לשמוע את דעתך, זה נותן לי על מה לחשוב...",
                    "אני מעריך את הנכונות שלך לשתף את מה שאתה חושב..."
            ),
            ConversationPhase.FINAL, List.of(
                    "בסוף, כולנו רוצים את הטוב למדינה ולאנשים שלנו. תודה על השיחה.",
                    "למרות הבדלי הדעות, ברור שלשנינו אכפת. היה חשוב לדבר.",
                    "תודה על השיחה. בתקופה כזאת, חשוב שנמשיך לדבר אחד עם השני, גם כשאנחנו לא מסכימים."
            )
    );

    private DialogueLexicon() {
        // Private constructor to prevent instantiation
    }

    public static String pick(List<String> phrases, Random random) {
        return phrases.get(random.nextInt(phrases.size()));
    }
}
