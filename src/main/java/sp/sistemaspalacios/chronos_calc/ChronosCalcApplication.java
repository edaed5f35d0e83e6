package sp.sistemaspalacios.chronos_calc;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ChronosCalcApplication {

    public static void main(String[] args) {
        SpringApplication.run(ChronosCalcApplication.class, args);
    }
}
