package sp.sistemaspalacios.chronos_calc.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Umbrales generales del motor. Lo específico de cada horario vive en el plan diario.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "chronos.calculation")
public class CalculationProperties {

    /** Minutos que la primera entrada / última salida pueden salirse de la ventana antes de ser error. */
    @Min(0)
    private int windowGraceMinutes = 30;

    /** Minutos brutos a partir de los cuales el día se marca como jornada larga. */
    @Min(1)
    @Max(1440)
    private int longWorkDayMinutes = 600;

    @Min(0)
    private int maxAlternativePlans = 6;
}
