package com.mouse.oneup;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Non-web context exposing {@link com.mouse.oneup.manager.LeadPricingRunner} and
 * {@link com.mouse.oneup.service.LeadPricingEngine} as beans. The host process that owns the
 * odds snapshots calls {@code LeadPricingRunner.run}; nothing is priced on startup.
 */
@SpringBootApplication
public class OneUpPricingApplication {

	public static void main(String[] args) {
		SpringApplication.run(OneUpPricingApplication.class, args);
	}

}
