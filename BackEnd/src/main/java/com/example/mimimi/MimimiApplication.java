package com.example.mimimi;

import com.example.mimimi.Config.MimimiProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@EnableConfigurationProperties(MimimiProperties.class)
@SpringBootApplication
public class MimimiApplication {

	public static void main(String[] args) {
		SpringApplication.run(MimimiApplication.class, args);
	}

}
