package dev.badgersnacks.compendium.variants;

/**
 * Raised when a variant template cannot be expanded safely. The template is skipped, the run continues.
 */
public class TemplateValidationException extends Exception {

    private final String templateName;

    public TemplateValidationException(String templateName, String message) {
        super("Skipping variant template '" + templateName + "': " + message);
        this.templateName = templateName;
    }

    public String templateName() {
        return templateName;
    }
}
