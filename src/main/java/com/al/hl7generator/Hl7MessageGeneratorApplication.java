package com.al.hl7generator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class Hl7MessageGeneratorApplication {

	public static void main(String[] args) {
		SpringApplication.run(Hl7MessageGeneratorApplication.class, args);
	}

}
