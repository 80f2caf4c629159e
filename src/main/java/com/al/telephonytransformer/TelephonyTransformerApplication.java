package com.al.telephonytransformer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TelephonyTransformerApplication {

	public static void main(String[] args) {
		SpringApplication.run(TelephonyTransformerApplication.class, args);
	}

}
