package com.agentide;

import com.agentide.dispatch.cli.AgentIdeCommand;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ApplicationContext;

@SpringBootApplication
public class AgentIdeApplication {

    public static void main(String[] args) {
        boolean serveMode = AgentIdeCommand.isServeMode(args);

        SpringApplicationBuilder builder = new SpringApplicationBuilder(AgentIdeApplication.class)
                .properties(
                        "spring.main.web-application-type=" + (serveMode ? "servlet" : "none"),
                        "spring.main.banner-mode=off");

        ApplicationContext ctx = builder.run(args);

        if (!serveMode) {
            int exitCode = SpringApplication.exit(ctx, ctx.getBean(ExitCodeGenerator.class));
            System.exit(exitCode);
        }
    }
}
