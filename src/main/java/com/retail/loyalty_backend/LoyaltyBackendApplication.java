package com.retail.loyalty_backend;

import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "com.retail.loyalty_backend")
@MapperScan("com.retail.loyalty_backend.modules.*.mapper")
public class LoyaltyBackendApplication {

	public static void main(String[] args) {
		SpringApplication.run(LoyaltyBackendApplication.class, args);
	}

}
