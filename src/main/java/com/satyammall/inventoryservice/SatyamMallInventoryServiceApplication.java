package com.satyammall.inventoryservice;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Info;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
@OpenAPIDefinition(info = @Info(title = "Satyam Mall Inventory API", version = "v1"))
public class SatyamMallInventoryServiceApplication {

	public static void main(String[] args) {
		SpringApplication.run(SatyamMallInventoryServiceApplication.class, args);
	}

}
