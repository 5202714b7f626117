package com.dailystatus.app.properties;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@ConfigurationProperties(prefix = "github")
public class GithubProperties {
    private String apiBaseUrl = "https://api.github.com";
    private String workflowRepo = "datalad/git-annex";
    private List<String> workflows = new ArrayList<>();
    private String clientsRepo = "datalad/git-annex-ci-client-jobs";
    private String clientsWorkflow = "handle-result.yaml";
    private String webBaseUrl = "https://github.com";
    private int perPage = 100;
    private int timeoutSec = 30;
    private String tokenEnv = "GITHUB_TOKEN";
}
