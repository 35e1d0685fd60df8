package eu.virtualparadox.hybridrag;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class HybridRagApplication {

    public static void main(final String[] args) {
        SpringApplication.run(HybridRagApplication.class, args);
    }
}
