package com.llestrade;

import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;

/**
 * Boots the analysis engine as an embeddable, non-web Spring context.
 * The submitting collaborator obtains {@code BulkAnalysisService}, {@code WorkerCoordinator}
 * and {@code EventBus} from the context.
 */
@SpringBootApplication
public class LlestradeApplication {

    public static void main(String[] args) {
        new SpringApplicationBuilder(LlestradeApplication.class)
                .properties(
                        "spring.main.web-application-type=none",
                        "spring.main.banner-mode=off"
                )
                .run(args);
    }
}
