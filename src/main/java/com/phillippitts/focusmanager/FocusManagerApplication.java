package com.phillippitts.focusmanager;

import com.phillippitts.focusmanager.config.properties.FocusProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties(FocusProperties.class)
@EnableScheduling
public class FocusManagerApplication {

    public static void main(String[] args) {
        SpringApplication.run(FocusManagerApplication.class, args);
    }

}
