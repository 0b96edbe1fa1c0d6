package com.al.radiologyfiller;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RadiologyOrderFillerApplication {

	public static void main(String[] args) {
		SpringApplication.run(RadiologyOrderFillerApplication.class, args);
	}

}
