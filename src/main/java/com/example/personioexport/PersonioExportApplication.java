package com.example.personioexport;

import com.example.personioexport.config.PersonioProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;

/**
 * Application entry point for the Personio export service.
 * With scheduling enabled the process keeps running and serves the health endpoint; otherwise it
 * exits after the startup export with status 0 on success and 1 on failure.
 */
@SpringBootApplication
public class PersonioExportApplication {

	/**
	 * Boots the Spring container.
	 *
	 * @param args optional command line arguments passed by the JVM
	 */
	public static void main(String[] args) {
		ConfigurableApplicationContext context = SpringApplication.run(PersonioExportApplication.class, args);
		if (!context.getBean(PersonioProperties.class).schedule().enabled()) {
			System.exit(SpringApplication.exit(context));
		}
	}

}
