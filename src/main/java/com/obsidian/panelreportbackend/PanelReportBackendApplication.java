package com.obsidian.panelreportbackend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PanelReportBackendApplication {

    public static void main(String[] args) {
        SpringApplication.run(PanelReportBackendApplication.class, args);
    }
}
