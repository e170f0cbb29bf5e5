package com.mouse.provisioner;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class AccountProvisionerApplication {

	public static void main(String[] args) {
		SpringApplication.run(AccountProvisionerApplication.class, args);
	}
}
