package sp.sistemaspalacios.chronos_calc.exception;

import java.util.List;

/**
 * Se lanza cuando un plan diario o una regla de pausa o de recargo están mal formados y no se deben guardar.
 */
public class ConfigurationValidationException extends IllegalArgumentException {

    private final List<String> errors;

    public ConfigurationValidationException(List<String> errors) {
        super("Invalid configuration: " + String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}
