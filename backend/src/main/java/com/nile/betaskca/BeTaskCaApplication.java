package com.nile.betaskca;

import com.nile.betaskca.config.AppConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(value = {AppConfig.class})
public class BeTaskCaApplication {

	public static void main(String[] args) {
		SpringApplication.run(BeTaskCaApplication.class, args);
	}

}
