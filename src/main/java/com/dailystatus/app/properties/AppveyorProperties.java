package com.dailystatus.app.properties;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Getter
@Setter
@ConfigurationProperties(prefix = "appveyor")
public class AppveyorProperties {
    private String baseUrl = "https://ci.appveyor.com";
    private String project = "mih/git-annex";
    private int recordsNumber = 20;
    private int timeoutSec = 30;
}
