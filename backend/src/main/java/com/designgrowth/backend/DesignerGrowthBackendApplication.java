package com.designgrowth.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DesignerGrowthBackendApplication {

	public static void main(String[] args) {
		SpringApplication.run(DesignerGrowthBackendApplication.class, args);
	}

}
