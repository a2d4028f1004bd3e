package world.willfrog.contract.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties({
        ContractProperties.class
})
public class ContractConfig {

    @Bean
    public Clock contractClock() {
        return Clock.systemUTC();
    }
}
