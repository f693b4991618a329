package com.example.exod_detector;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ExodDetectorApplication {

	public static void main(String[] args) {
		// closes the context so the tile pool does not keep the JVM alive
		System.exit(SpringApplication.exit(SpringApplication.run(ExodDetectorApplication.class, args)));
	}

}
