package com.sandy.aiot.alert.digest;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
public class AiotAlertDigestApplication {

	public static void main(String[] args) {
		SpringApplication.run(AiotAlertDigestApplication.class, args);
	}

}
