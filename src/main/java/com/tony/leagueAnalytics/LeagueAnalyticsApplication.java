package com.tony.leagueAnalytics;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LeagueAnalyticsApplication {

	public static void main(String[] args) {
		SpringApplication.run(LeagueAnalyticsApplication.class, args);
	}

}
