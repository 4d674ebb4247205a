package com.quick.trio;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TrioApplication {

	public static void main(String[] args) {
		SpringApplication.run(TrioApplication.class, args);
	}

}
