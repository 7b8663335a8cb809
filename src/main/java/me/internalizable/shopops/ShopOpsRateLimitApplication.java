package me.internalizable.shopops;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ShopOpsRateLimitApplication {

    public static void main(String[] args) {
        SpringApplication.run(ShopOpsRateLimitApplication.class, args);
    }
}
