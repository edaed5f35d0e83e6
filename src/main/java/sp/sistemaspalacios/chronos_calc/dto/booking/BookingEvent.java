package sp.sistemaspalacios.chronos_calc.dto.booking;

import java.util.Objects;

/**
 * Una marcación del reloj en un día. Las horas son minutos desde medianoche.
 * <p>
 * {@code editedTime} es la hora corregida cuando un supervisor ajustó la marcación; la original
 * nunca se sobrescribe.
 */
public record BookingEvent(String id, BookingCategory category, int originalTime, Integer editedTime) {

    public BookingEvent {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(category, "category");
        requireInstant(originalTime, "originalTime");
        if (editedTime != null) {
            requireInstant(editedTime, "editedTime");
        }
    }

    public static BookingEvent of(String id, BookingCategory category, int time) {
        return new BookingEvent(id, category, time, null);
    }

    public int effectiveTime() {
        return editedTime != null ? editedTime : originalTime;
    }

    public boolean isEdited() {
        return editedTime != null && editedTime != originalTime;
    }

    public BookingEvent withEditedTime(int time) {
        return new BookingEvent(id, category, originalTime, time);
    }

    private static void requireInstant(int minutes, String field) {
        if (minutes < 0 || minutes >= 1440) {
            throw new IllegalArgumentException(field + " must be within [0,1440): " + minutes);
        }
    }
}
