package org.caureq.caureqmonitor;

import org.caureq.caureqmonitor.config.AppProps;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(AppProps.class)
public class CaureqMonitorApplication {

    public static void main(String[] args) {
        SpringApplication.run(CaureqMonitorApplication.class, args);
    }

}
