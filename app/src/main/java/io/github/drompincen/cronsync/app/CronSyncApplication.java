package io.github.drompincen.cronsync.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "io.github.drompincen.cronsync.app")
public class CronSyncApplication {

    public static void main(String[] args) {
        SpringApplication.run(CronSyncApplication.class, args);
    }
}
