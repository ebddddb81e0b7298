package com.lgcns.sdp.dkg;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class DkgApplication {

    public static void main(String[] args) {
        SpringApplication.run(DkgApplication.class, args);
    }
}
