package ch.so.arp.kbdb;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class KbdbSearchApplication {

    public static void main(String[] args) {
        SpringApplication.run(KbdbSearchApplication.class, args);
    }
}
