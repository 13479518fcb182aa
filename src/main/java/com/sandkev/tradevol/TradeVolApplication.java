package com.sandkev.tradevol;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class TradeVolApplication {

	public static void main(String[] args) {
		SpringApplication.run(TradeVolApplication.class, args);
	}

}
