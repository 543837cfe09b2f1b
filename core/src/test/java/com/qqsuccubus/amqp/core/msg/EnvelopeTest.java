package com.qqsuccubus.amqp.core.msg;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class EnvelopeTest {

    @Test
    void testBody_CallerMutationDoesNotLeak() {
        Envelope envelope = Envelope.builder()
            .body("[1,2]".getBytes(StandardCharsets.UTF_8))
            .build();

        byte[] body = envelope.getBody();
        body[0] = 'X';

        assertEquals("[1,2]", envelope.bodyAsString());
        assertEquals('[', envelope.getBody()[0]);
    }

    @Test
    void testDefaults() {
        Envelope envelope = Envelope.builder().build();

        assertEquals(0, envelope.getBody().length);
        assertNull(envelope.getHeader("jsonrpc"));
    }
}
