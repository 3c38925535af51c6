package uk.gegc.eventpay;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class EventPayApplication {

    public static void main(String[] args) {
        SpringApplication.run(EventPayApplication.class, args);
    }
}
