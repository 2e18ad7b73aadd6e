package com.agentarena.gateway;

import com.agentarena.channels.ArenaCommands;
import com.agentarena.channels.CliAdapter;
import com.agentarena.progression.ProgressionFacade;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

import java.io.BufferedReader;
import java.io.InputStreamReader;

@SpringBootApplication(scanBasePackages = "com.agentarena.gateway")
public class AgentArenaApp {

    private static final Logger log = LoggerFactory.getLogger(AgentArenaApp.class);

    public static void main(String[] args) {
        var ctx = SpringApplication.run(AgentArenaApp.class, args);

        var facade = ctx.getBean(ProgressionFacade.class);
        var discovery = facade.discover();
        discovery.warnings().forEach(w -> log.warn("Descriptor skipped: {}", w));

        if (!ctx.getEnvironment().getProperty("arena.cli.enabled", Boolean.class, true)) {
            log.info("CLI disabled, serving HTTP and WebSocket only");
            return;
        }

        var commands = ctx.getBean(ArenaCommands.class);
        var cli = new CliAdapter(new BufferedReader(new InputStreamReader(System.in)), System.out);
        cli.onStop(ctx::close);
        cli.start(input -> cli.send(commands.handle(input)));
    }
}
