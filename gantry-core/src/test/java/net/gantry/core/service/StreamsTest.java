package net.gantry.core.service;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class StreamsTest {

    @Test
    void namingConvention() {
        assertEquals("jobs:inference", Streams.jobs("inference"));
        assertEquals("jobs:inference:dlq", Streams.deadLetter("inference"));
        assertEquals("cg:inference:mistral-warm", Streams.group("inference", "mistral-warm"));
        assertEquals("cg:inference:default", Streams.group("inference", null));
    }

    @Test
    void deadLetterStreamsAreRecognised() {
        assertTrue(Streams.isDeadLetter(Streams.deadLetter("embed")));
        assertFalse(Streams.isDeadLetter(Streams.jobs("embed")));
    }

    @Test
    void poolIdDefaultsToAgentAndAdapter() {
        assertEquals("embedder-base", new PoolRequest("embedder", "m", null, 1, 60L, null, null).resolvedPoolId());
        assertEquals("embedder-lora1", new PoolRequest("embedder", "m", "lora1", 1, 60L, " ", null).resolvedPoolId());
        assertEquals("given", new PoolRequest("embedder", "m", "lora1", 1, 60L, "given", null).resolvedPoolId());
    }
}
