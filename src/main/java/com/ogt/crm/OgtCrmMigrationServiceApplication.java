package com.ogt.crm;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class OgtCrmMigrationServiceApplication {

	public static void main(String[] args) {
		SpringApplication.run(OgtCrmMigrationServiceApplication.class, args);
	}

}
