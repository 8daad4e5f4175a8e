package dev.pluginlink.server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PluginHostApplication {

    public static void main(String[] args) {
        SpringApplication.run(PluginHostApplication.class, args);
    }
}
