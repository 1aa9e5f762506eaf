package com.pickem.pickem_api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PickemApiApplication {

	public static void main(String[] args) {
		SpringApplication.run(PickemApiApplication.class, args);
	}

}
