package com.work.batchbuy;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Spring Boot 启动入口：REST 触发批量运行，或设置 batch.run-on-startup=true 启动即执行一次。
 */
@SpringBootApplication
public class BatchBuyApplication {

    public static void main(String[] args) {
        SpringApplication.run(BatchBuyApplication.class, args);
    }
}
