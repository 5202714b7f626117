package com.dailystatus.app.properties;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Getter
@Setter
@ConfigurationProperties(prefix = "report")
public class ReportProperties {
    private int lookbackHours = 24;
    private String clientsFile = "clients/clients.yaml";
    private String resultSuffix = ".rc";
}
