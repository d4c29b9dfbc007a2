package com.zzf.codesync;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CodeSyncApplication {
    private static final Logger logger = LoggerFactory.getLogger(CodeSyncApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(CodeSyncApplication.class, args);
        logger.info("codesync.started");
    }
}
