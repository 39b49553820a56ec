package io.cronkit;

import io.cronkit.cron.CronExpression;
import io.cronkit.exception.TranslationException;

/**
 * Turns free text such as "every day at 2am" into a cron expression.
 *
 * <p>Implementations live outside this library. Their output is untrusted input: it goes through the same
 * parser as a hand-written expression before use.
 */
@FunctionalInterface
public interface CronTranslator {

    /**
     * @return cron expression text
     * @throws TranslationException if the text is not recognized
     */
    String translate(String text);

    /**
     * Translate and validate in one step.
     *
     * @throws TranslationException if the text is not recognized
     * @throws io.cronkit.exception.CronParseException if the translation is not a valid expression
     */
    default CronExpression toExpression(String text) {
        String cron = translate(text);
        if (cron == null || cron.isBlank()) {
            throw new TranslationException(text, "Translator produced no cron expression for: " + text);
        }
        return CronExpression.parse(cron);
    }
}
