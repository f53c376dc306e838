package com.rebenew.listeningRooms.syncserver;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class ListeningRoomsServerApplication {
	public static void main(String[] args) {
		SpringApplication.run(ListeningRoomsServerApplication.class, args);
	}
}
