package com.yuzhi.sqlguard.platform;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SqlGuardPlatformApp {

    public static void main(String[] args) {
        SpringApplication.run(SqlGuardPlatformApp.class, args);
    }
}
