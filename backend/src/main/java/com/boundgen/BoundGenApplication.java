package com.boundgen;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * BoundGen - constraint-bound structured document generation.
 */
@SpringBootApplication
@EnableScheduling
public class BoundGenApplication {

	public static void main(String[] args) {
		SpringApplication.run(BoundGenApplication.class, args);
	}

}
