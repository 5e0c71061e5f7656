package org.iceforge.placefinder.synth;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({DeploymentProperties.class})
public class PlaceFinderInfraApplication {

	public static void main(String[] args) {
		SpringApplication.run(PlaceFinderInfraApplication.class, args);
	}
}
