package fun.ai.functions;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FunAiFunctionsApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(FunAiFunctionsApiApplication.class, args);
    }
}
