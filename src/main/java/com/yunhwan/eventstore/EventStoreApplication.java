package com.yunhwan.eventstore;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class EventStoreApplication {

	public static void main(String[] args) {
		SpringApplication.run(EventStoreApplication.class, args);
	}

}
