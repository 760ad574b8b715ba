package org.kidoni.cas.shell;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class CasShellApplication {

	public static void main(String[] args) {
		SpringApplication.run(CasShellApplication.class, args);
	}

}
