package sp.sistemaspalacios.chronos_calc.dto.booking;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum BookingCategory {
    COME("come", PairKind.WORK),
    GO("go", PairKind.WORK),
    BREAK_START("break_start", PairKind.BREAK),
    BREAK_END("break_end", PairKind.BREAK);

    private final String code;
    private final PairKind pairKind;

    BookingCategory(String code, PairKind pairKind) {
        this.code = code;
        this.pairKind = pairKind;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public PairKind getPairKind() {
        return pairKind;
    }

    @JsonCreator
    public static BookingCategory fromCode(String code) {
        return Arrays.stream(values())
                .filter(c -> c.code.equalsIgnoreCase(code))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown booking category: " + code));
    }
}
