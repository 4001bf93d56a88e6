package com.railtime.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RailtimeApplication {

	public static void main(String[] args) {
		SpringApplication.run(RailtimeApplication.class, args);
	}

}
