package com.signalscope.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SignalScopeApplication {
	public static void main(String[] args) {
		SpringApplication.run(SignalScopeApplication.class, args);
	}
}
