package com.chainscope;

import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;

/**
 * Boots the data core without a web server; the terminal front end embeds the context.
 */
@SpringBootApplication
public class ChainscopeApplication {

    public static void main(String[] args) {
        new SpringApplicationBuilder(ChainscopeApplication.class)
                .web(WebApplicationType.NONE)
                .run(args);
    }
}
