package com.example.procloner;

import com.example.procloner.config.CrawlProperties;
import com.example.procloner.config.SessionProperties;
import com.example.procloner.config.StorageProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({StorageProperties.class, CrawlProperties.class, SessionProperties.class})
public class ProClonerApplication {

	public static void main(String[] args) {
		SpringApplication.run(ProClonerApplication.class, args);
	}
}
