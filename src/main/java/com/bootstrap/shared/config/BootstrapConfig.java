package com.bootstrap.shared.config;

import lombok.Getter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * 專案層級設定
 *
 * 對應 application.yml:
 * bootstrap:
 *   project-id: my-saas          # PROJECT_ID
 *   project-domain: https://my-saas.example.com
 *   output-dir: .                # .env.local.generated 輸出目錄
 */
@Getter
@ConfigurationProperties(prefix = "bootstrap")
public class BootstrapConfig {

    private final String projectId;
    private final String projectDomain;
    private final String outputDir;

    public BootstrapConfig(String projectId,
                           String projectDomain,
                           @DefaultValue(".") String outputDir) {
        this.projectId = projectId;
        this.projectDomain = projectDomain;
        this.outputDir = outputDir;
    }
}
