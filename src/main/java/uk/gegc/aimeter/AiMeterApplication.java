package uk.gegc.aimeter;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AiMeterApplication {

    public static void main(String[] args) {
        SpringApplication.run(AiMeterApplication.class, args);
    }
}
