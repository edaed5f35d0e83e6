package sp.sistemaspalacios.chronos_calc.dto.daily;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Utilidades para los conjuntos inmutables de códigos de los resultados diarios.
 */
public final class CodeSets {

    private CodeSets() {
    }

    public static <E extends Enum<E>> Set<E> copyOf(Class<E> type, Collection<E> codes) {
        EnumSet<E> set = EnumSet.noneOf(type);
        if (codes != null) {
            set.addAll(codes);
        }
        return Collections.unmodifiableSet(set);
    }

    public static <E extends Enum<E>> Set<E> union(Class<E> type, Collection<E> a, Collection<E> b) {
        EnumSet<E> set = EnumSet.noneOf(type);
        if (a != null) set.addAll(a);
        if (b != null) set.addAll(b);
        return Collections.unmodifiableSet(set);
    }

    /** Forma persistida: códigos separados por coma, en el orden del enum. */
    public static <E extends Enum<E>> String join(Collection<E> codes, Function<E, String> toCode) {
        if (codes == null || codes.isEmpty()) {
            return "";
        }
        return codes.stream().sorted().map(toCode).collect(Collectors.joining(","));
    }
}
