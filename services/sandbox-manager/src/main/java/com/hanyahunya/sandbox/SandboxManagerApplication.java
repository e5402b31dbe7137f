package com.hanyahunya.sandbox;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class SandboxManagerApplication {

	public static void main(String[] args) {
		SpringApplication.run(SandboxManagerApplication.class, args);
	}

}
