package com.bbthechange.tutoring;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;

@SpringBootApplication
public class TutoringApplication {

	private static final Logger logger = LoggerFactory.getLogger(TutoringApplication.class);

	public static void main(String[] args) {
		SpringApplication app = new SpringApplication(TutoringApplication.class);
		app.run(args);
	}

	@EventListener(WebServerInitializedEvent.class)
	public void onWebServerReady(WebServerInitializedEvent event) {
		logger.info("Tutoring booking service listening on port {}", event.getWebServer().getPort());
	}

}
