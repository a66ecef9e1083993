package com.boomerang.gateway;

import com.boomerang.dispatch.MessengerBot;
import com.boomerang.shared.config.BoomerangConfig;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class GatewayConfiguration {

    @Bean(destroyMethod = "stop")
    public MessengerGateway messengerGateway(BoomerangConfig config, ObjectProvider<MessengerBot> bot) {
        var gateway = MessengerGateway.builder(config)
                .bot(bot.getIfAvailable(EchoBot::new))
                .build();
        gateway.start();
        return gateway;
    }
}
