package com.baykanat.triggers;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/** Uygulama giriş noktası; @EnableScheduling ile delivery poller, stream heartbeat ve cleanup job'ları. */
@SpringBootApplication
@EnableScheduling
public class TriggersApplication {

	public static void main(String[] args) {
		SpringApplication.run(TriggersApplication.class, args);
	}

}
