package io.github.drompincen.toolguard.gateway;

import io.github.drompincen.toolguard.runtime.checkpoint.CheckpointProperties;
import io.github.drompincen.toolguard.runtime.session.GitSessionProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication(scanBasePackages = "io.github.drompincen.toolguard")
@EnableConfigurationProperties({CheckpointProperties.class, GitSessionProperties.class})
public class ToolGuardApplication {

    public static void main(String[] args) {
        SpringApplication.run(ToolGuardApplication.class, args);
    }
}
