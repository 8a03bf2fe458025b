package com.chatcoach;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * ChatCoach - reply generation pipeline for chat conversations.
 */
@SpringBootApplication
public class ChatCoachApplication {

	public static void main(String[] args) {
		SpringApplication.run(ChatCoachApplication.class, args);
	}

}
