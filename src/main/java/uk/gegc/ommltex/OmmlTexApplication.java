package uk.gegc.ommltex;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class OmmlTexApplication {

    public static void main(String[] args) {
        SpringApplication.run(OmmlTexApplication.class, args);
    }
}
