package sp.sistemaspalacios.chronos_calc.entity.converter;

import jakarta.persistence.Converter;
import sp.sistemaspalacios.chronos_calc.dto.daily.DayErrorCode;

@Converter
public class DayErrorCodeSetConverter extends EnumCodeSetConverter<DayErrorCode> {

    public DayErrorCodeSetConverter() {
        super(DayErrorCode.class, DayErrorCode::fromCode);
    }
}
