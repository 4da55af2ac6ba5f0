package com.medimind.intake;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ClinicalIntakeApplication {

	public static void main(String[] args) {
		SpringApplication.run(ClinicalIntakeApplication.class, args);
	}
}
