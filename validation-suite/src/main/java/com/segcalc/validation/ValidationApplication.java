package com.segcalc.validation;

import com.segcalc.engine.config.EngineConfig;
import com.segcalc.engine.service.ObjectCalculationService;
import com.segcalc.validation.model.ValidationSummary;
import com.segcalc.validation.report.ValidationReportFormatter;
import com.segcalc.validation.service.ValidationHarness;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.context.annotation.Profile;

@SpringBootApplication
@Import({EngineConfig.class, ObjectCalculationService.class})
public class ValidationApplication {

    public static void main(String[] args) {
        SpringApplication.run(ValidationApplication.class, args);
    }

    /** Runs the full catalogue once at start-up and prints the Markdown summary. */
    @Bean
    @Profile("!test")
    public CommandLineRunner validationRunner(ValidationHarness harness, ValidationReportFormatter formatter) {
        return args -> {
            ValidationSummary summary = harness.run();
            System.out.println(formatter.format(summary));
        };
    }
}
