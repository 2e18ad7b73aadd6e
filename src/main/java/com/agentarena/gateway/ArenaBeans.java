package com.agentarena.gateway;

import com.agentarena.channels.ArenaCommands;
import com.agentarena.gateway.ws.NotificationWebSocketHandler;
import com.agentarena.observability.DoctorCommand;
import com.agentarena.observability.MetricsConfig;
import com.agentarena.progression.ProgressionFacade;
import com.agentarena.progression.XpPolicy;
import com.agentarena.shared.config.ArenaConfig;
import com.agentarena.shared.config.ConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ArenaBeans {

    private static final Logger log = LoggerFactory.getLogger(ArenaBeans.class);

    @Bean
    public ArenaConfig arenaConfig() {
        var config = ConfigLoader.load();
        log.info("Search roots {}, ledger {}, cache TTL {}s",
            config.searchRoots(), config.ledgerFile(), config.cacheTtl().toSeconds());
        return config;
    }

    @Bean
    public MetricsConfig metricsConfig() {
        return new MetricsConfig();
    }

    @Bean
    public ProgressionFacade progressionFacade(ArenaConfig config, MetricsConfig metrics,
                                               NotificationWebSocketHandler notifications) {
        var facade = ProgressionFacade.create(config, metrics);
        facade.addListener(notifications);
        return facade;
    }

    @Bean
    public XpPolicy xpPolicy() {
        return new XpPolicy();
    }

    @Bean
    public DoctorCommand doctorCommand(ArenaConfig config, ProgressionFacade facade) {
        return new DoctorCommand(config.searchRoots(), facade.ledger().store());
    }

    @Bean
    public ArenaCommands arenaCommands(ProgressionFacade facade, DoctorCommand doctor, XpPolicy xpPolicy) {
        return new ArenaCommands(facade, doctor, xpPolicy);
    }
}
