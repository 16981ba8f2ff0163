package com.fundfeed;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Fund market-data acquisition service: fetches quotes, NAV history and sector fund flows
 * from several vendors behind per-source circuit breakers, caching every answer so that a
 * stale value can be served when all vendors fail.
 *
 * <p>Scheduling drives the periodic cache compaction in CacheMaintenanceService.
 */
@SpringBootApplication
@EnableScheduling
public class FundfeedApplication {

    public static void main(String[] args) {
        SpringApplication.run(FundfeedApplication.class, args);
    }
}
