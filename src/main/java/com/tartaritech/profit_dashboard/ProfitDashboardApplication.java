package com.tartaritech.profit_dashboard;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ProfitDashboardApplication {

	public static void main(String[] args) {
		SpringApplication.run(ProfitDashboardApplication.class, args);
	}

}
