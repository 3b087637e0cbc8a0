package com.letterdesk.reviewcore;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication(scanBasePackages = "com.letterdesk.reviewcore")
@EnableJpaRepositories(basePackages = "com.letterdesk.reviewcore.infrastructure.jpa")
@EntityScan(basePackages = "com.letterdesk.reviewcore.infrastructure.jpa")
@EnableScheduling
public class LetterDeskCoreApplication {
	public static void main(String[] args) {
		SpringApplication.run(LetterDeskCoreApplication.class, args);
	}
}
