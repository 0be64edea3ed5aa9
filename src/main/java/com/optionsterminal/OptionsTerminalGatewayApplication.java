package com.optionsterminal;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class OptionsTerminalGatewayApplication {

    public static void main(String[] args) {
        SpringApplication.run(OptionsTerminalGatewayApplication.class, args);
    }
}
