package com.boomerang.gateway;

import com.boomerang.dispatch.MessengerBot;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.ObjectProvider;

import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class GatewayConfigurationTest {

    @Test
    @SuppressWarnings("unchecked")
    void fallsBackToEchoBotAndStartsTheGateway() {
        ObjectProvider<MessengerBot> provider = mock(ObjectProvider.class);
        when(provider.getIfAvailable(any(Supplier.class)))
                .thenAnswer(inv -> ((Supplier<MessengerBot>) inv.getArgument(0)).get());

        var gateway = new GatewayConfiguration().messengerGateway(GatewayFixtures.config(), provider);
        try {
            assertTrue(gateway.isRunning());
            verify(provider).getIfAvailable(any(Supplier.class));
        } finally {
            gateway.stop();
        }
        assertFalse(gateway.isRunning());
    }
}
