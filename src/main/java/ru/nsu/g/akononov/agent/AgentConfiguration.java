package ru.nsu.g.akononov.agent;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import ru.nsu.g.akononov.agent.probe.SocksProbe;
import ru.nsu.g.akononov.agent.state.AgentStateStore;

import java.time.Clock;

/**
 * The process-wide instances shared by the control API.
 */
@Configuration
public class AgentConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public AgentStateStore agentStateStore(Clock clock) {
        return new AgentStateStore(clock);
    }

    @Bean
    public SocksProbe socksProbe(Clock clock) {
        return new SocksProbe(clock);
    }
}
