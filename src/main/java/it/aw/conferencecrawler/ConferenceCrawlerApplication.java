package it.aw.conferencecrawler;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ConferenceCrawlerApplication {

    public static void main(String[] args) {
        SpringApplication.run(ConferenceCrawlerApplication.class, args);
    }
}
