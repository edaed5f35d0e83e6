package sp.sistemaspalacios.chronos_calc.entity.converter;

import jakarta.persistence.AttributeConverter;
import sp.sistemaspalacios.chronos_calc.dto.daily.CodeSets;

import java.util.Arrays;
import java.util.Set;
import java.util.function.Function;

/**
 * Guarda un conjunto de códigos de enum en una columna separada por comas, en el orden del enum.
 */
public abstract class EnumCodeSetConverter<E extends Enum<E>> implements AttributeConverter<Set<E>, String> {

    private final Class<E> type;
    private final Function<String, E> parser;

    protected EnumCodeSetConverter(Class<E> type, Function<String, E> parser) {
        this.type = type;
        this.parser = parser;
    }

    @Override
    public String convertToDatabaseColumn(Set<E> attribute) {
        return CodeSets.join(attribute, Enum::name);
    }

    @Override
    public Set<E> convertToEntityAttribute(String dbData) {
        if (dbData == null || dbData.isBlank()) {
            return CodeSets.copyOf(type, Set.of());
        }
        return CodeSets.copyOf(type, Arrays.stream(dbData.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .map(parser)
                .toList());
    }
}
