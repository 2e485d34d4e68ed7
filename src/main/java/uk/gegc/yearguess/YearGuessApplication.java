package uk.gegc.yearguess;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class YearGuessApplication {

    public static void main(String[] args) {
        SpringApplication.run(YearGuessApplication.class, args);
    }
}
