package com.example.paperdigest;

import com.example.paperdigest.config.DigestProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties(DigestProperties.class)
public class PaperDigestApplication {

    public static void main(String[] args) {
        SpringApplication.run(PaperDigestApplication.class, args);
    }
}
