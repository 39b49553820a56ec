package io.cronkit.exception;

/**
 * Raised by a {@link io.cronkit.CronTranslator} when the input text is not recognized.
 */
public class TranslationException extends CronKitException {

    private final String input;

    public TranslationException(String input, String message) {
        super(message);
        this.input = input;
    }

    public String input() {
        return input;
    }
}
