package sp.sistemaspalacios.chronos_calc.dto.schedule;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * En qué se convierte un día con plan y sin ninguna marcación.
 */
public enum NoBookingPolicy {
    ERROR("error"),
    CREDIT_TARGET("credit_target"),
    CREDIT_ZERO("credit_zero"),
    SKIP("skip"),
    USE_ABSENCE("use_absence");

    private final String code;

    NoBookingPolicy(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static NoBookingPolicy fromCode(String code) {
        return Arrays.stream(values())
                .filter(p -> p.code.equalsIgnoreCase(code))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown no-booking policy: " + code));
    }
}
