package com.securepower.antitheft;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

@SpringBootApplication(scanBasePackages = "com.securepower.antitheft")
@EnableJpaRepositories(basePackages = "com.securepower.antitheft.infrastructure.jpa")
@EntityScan(basePackages = "com.securepower.antitheft.infrastructure.jpa")
public class SecurePowerCoreApplication {
	public static void main(String[] args) {
		SpringApplication.run(SecurePowerCoreApplication.class, args);
	}
}
