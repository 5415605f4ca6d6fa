package com.assessorai;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.util.Arrays;

/**
 * AssessorAi - fail-closed three-stage document analysis pipeline.
 */
@SpringBootApplication
@EnableScheduling
public class AssessorAiApplication {

	public static void main(String[] args) {
		ConfigurableApplicationContext context = SpringApplication.run(AssessorAiApplication.class, args);
		if (Arrays.asList(context.getEnvironment().getActiveProfiles()).contains("cli")) {
			System.exit(SpringApplication.exit(context));
		}
	}

}
