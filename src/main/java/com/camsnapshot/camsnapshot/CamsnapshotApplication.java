package com.camsnapshot.camsnapshot;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class CamsnapshotApplication {

	public static void main(String[] args) {
		SpringApplication.run(CamsnapshotApplication.class, args);
	}

}
