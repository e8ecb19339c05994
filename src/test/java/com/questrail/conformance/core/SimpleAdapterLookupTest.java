package com.questrail.conformance.core;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SimpleAdapterLookupTest {

    interface Gateway {
    }

    static final class FakeGateway implements Gateway {
    }

    @Test
    void returnsRegisteredAdapter() {
        FakeGateway gateway = new FakeGateway();
        SimpleAdapterLookup lookup = SimpleAdapterLookup.builder()
                .withAdapter(Gateway.class, gateway)
                .build();

        assertSame(gateway, lookup.getAdapter(Gateway.class));
    }

    @Test
    void laterRegistrationReplacesEarlier() {
        FakeGateway first = new FakeGateway();
        FakeGateway second = new FakeGateway();
        SimpleAdapterLookup lookup = SimpleAdapterLookup.builder()
                .withAdapter(Gateway.class, first)
                .withAdapter(Gateway.class, second)
                .build();

        assertSame(second, lookup.getAdapter(Gateway.class));
    }

    @Test
    void unknownTypeFails() {
        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> SimpleAdapterLookup.empty().getAdapter(Gateway.class));
        assertEquals("No adapter registered for type " + Gateway.class.getName(), e.getMessage());
    }
}
