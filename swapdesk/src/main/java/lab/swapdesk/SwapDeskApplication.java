package lab.swapdesk;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class SwapDeskApplication {

    public static void main(String[] args) {
        SpringApplication.run(SwapDeskApplication.class, args);
    }
}
