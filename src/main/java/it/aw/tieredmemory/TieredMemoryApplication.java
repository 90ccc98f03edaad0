package it.aw.tieredmemory;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TieredMemoryApplication {

    public static void main(String[] args) {
        SpringApplication.run(TieredMemoryApplication.class, args);
    }
}
