package dev.univer.kuberan;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class KuberanBotApplication {
    public static void main(String[] args) {
        SpringApplication.run(KuberanBotApplication.class, args);
    }
}
