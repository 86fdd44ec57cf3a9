package com.work.escrow;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Spring Boot 启动入口，运行后即可通过 REST 接口体验托管协议。
 */
@SpringBootApplication
@EnableScheduling
public class EscrowDemoApplication {

    public static void main(String[] args) {
        SpringApplication.run(EscrowDemoApplication.class, args);
    }
}
