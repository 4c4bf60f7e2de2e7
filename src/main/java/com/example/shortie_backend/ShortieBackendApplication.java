package com.example.shortie_backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ShortieBackendApplication {

	public static void main(String[] args) {
		SpringApplication.run(ShortieBackendApplication.class, args);
	}

}
