package com.yerin.bgjob;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class BgjobApplication {

	public static void main(String[] args) {
		SpringApplication.run(BgjobApplication.class, args);
	}

}
