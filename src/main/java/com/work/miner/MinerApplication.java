package com.work.miner;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Spring Boot 启动入口：默认连接 mock 链，通过 /api/v1/miner 接口驱动 pump/mine 轮次。
 */
@SpringBootApplication
@EnableScheduling
public class MinerApplication {

    public static void main(String[] args) {
        SpringApplication.run(MinerApplication.class, args);
    }
}
