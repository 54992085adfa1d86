package ch.so.arp.rag.qa;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class QaTreeApplication {

    public static void main(String[] args) {
        SpringApplication.run(QaTreeApplication.class, args);
    }
}
