package sp.sistemaspalacios.chronos_calc.service.common;

import org.springframework.stereotype.Service;

import java.time.LocalTime;
import java.time.format.DateTimeFormatter;

/**
 * Utilidades de minutos del día; 0 es las 00:00 y 1440 el límite de fin de día.
 */
@Service
public class TimeService {

    public static final int MINUTES_PER_DAY = 24 * 60;

    private static final DateTimeFormatter HH_MM = DateTimeFormatter.ofPattern("HH:mm");

    /** Formats minutes as "HH:mm"; 1440 renders as "24:00". */
    public String format(Integer minutes) {
        if (minutes == null) return null;
        if (minutes == MINUTES_PER_DAY) return "24:00";
        return LocalTime.of(minutes / 60, minutes % 60).format(HH_MM);
    }

    public static boolean isBound(int minutes) {
        return minutes >= 0 && minutes <= MINUTES_PER_DAY;
    }

    /** Lleva a la hora de reloj un minuto fuera del día, p. ej. 1800 a 360 o -120 a 1320. */
    public static int toClock(int minutes) {
        return isBound(minutes) ? minutes : Math.floorMod(minutes, MINUTES_PER_DAY);
    }

    public static int clampToDay(int minutes) {
        return Math.max(0, Math.min(MINUTES_PER_DAY, minutes));
    }
}
