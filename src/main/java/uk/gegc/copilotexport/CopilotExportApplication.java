package uk.gegc.copilotexport;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CopilotExportApplication {

    public static void main(String[] args) {
        SpringApplication.run(CopilotExportApplication.class, args);
    }
}
