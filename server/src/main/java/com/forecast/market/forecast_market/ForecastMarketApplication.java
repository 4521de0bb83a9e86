package com.forecast.market.forecast_market;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class ForecastMarketApplication {

	public static void main(String[] args) {
		SpringApplication.run(ForecastMarketApplication.class, args);
	}

}
