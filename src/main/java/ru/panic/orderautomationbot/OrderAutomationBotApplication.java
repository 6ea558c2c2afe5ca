package ru.panic.orderautomationbot;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class OrderAutomationBotApplication {
    public static void main(String[] args) {
        SpringApplication.run(OrderAutomationBotApplication.class, args);
    }
}
