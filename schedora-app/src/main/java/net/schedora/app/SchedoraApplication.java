package net.schedora.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SchedoraApplication {
    public static void main(String[] args) {
        SpringApplication.run(SchedoraApplication.class, args);
    }
}
