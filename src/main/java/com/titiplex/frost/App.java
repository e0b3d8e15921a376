package com.titiplex.frost;

import com.titiplex.frost.core.maintenance.SessionMaintenanceService;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ConfigurableApplicationContext;

/**
 * Headless coordinator process: opens the store and runs the maintenance sweeps. Sessions are
 * driven through the services in the context.
 */
public class App {

    public static void main(String[] args) {
        ConfigurableApplicationContext context = new SpringApplicationBuilder(SpringConfig.class)
                .web(WebApplicationType.NONE)
                .run(args);
        SessionMaintenanceService maintenance = context.getBean(SessionMaintenanceService.class);
        maintenance.start();
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            maintenance.stop();
            context.close();
        }, "frost-shutdown"));
    }
}
