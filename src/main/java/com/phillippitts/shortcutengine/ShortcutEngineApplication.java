package com.phillippitts.shortcutengine;

import com.phillippitts.shortcutengine.config.properties.ShortcutProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(ShortcutProperties.class)
public class ShortcutEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(ShortcutEngineApplication.class, args);
    }

}
