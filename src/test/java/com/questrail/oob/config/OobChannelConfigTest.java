package com.questrail.oob.config;

import com.questrail.oob.codec.token.OobWireFormat;
import com.questrail.oob.transport.OobServiceRecord;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class OobChannelConfigTest {

    @Test
    void defaults() {
        OobChannelConfig config = OobChannelConfig.defaults();

        assertEquals(Duration.ofSeconds(30), config.acceptTimeout());
        assertEquals(Duration.ZERO, config.readTimeout());
        assertEquals(OobWireFormat.STRUCTURED, config.wireFormat());
        assertEquals(64 * 1024, config.maxPayloadBytes());
        assertEquals(OobServiceRecord.DEFAULT, config.serviceRecord());
        assertEquals(UUID.fromString("00001101-0000-1000-8000-00805F9B34FB"), config.serviceRecord().id());
    }

    @Test
    void builderOverridesEachField() {
        OobServiceRecord record = new OobServiceRecord("pairing", UUID.randomUUID());

        OobChannelConfig config = OobChannelConfig.builder()
                .withAcceptTimeout(Duration.ofSeconds(3))
                .withReadTimeout(Duration.ofMillis(500))
                .withWireFormat(OobWireFormat.RAW)
                .withMaxPayloadBytes(128)
                .withServiceRecord(record)
                .build();

        assertEquals(Duration.ofSeconds(3), config.acceptTimeout());
        assertEquals(Duration.ofMillis(500), config.readTimeout());
        assertEquals(OobWireFormat.RAW, config.wireFormat());
        assertEquals(128, config.maxPayloadBytes());
        assertEquals(record, config.serviceRecord());
    }

    @Test
    void rejectsNonPositiveAcceptTimeout() {
        assertThrows(IllegalArgumentException.class,
                () -> OobChannelConfig.builder().withAcceptTimeout(Duration.ZERO).build());
        assertThrows(IllegalArgumentException.class,
                () -> OobChannelConfig.builder().withAcceptTimeout(Duration.ofSeconds(-1)).build());
    }

    @Test
    void rejectsNegativeReadTimeout() {
        assertThrows(IllegalArgumentException.class,
                () -> OobChannelConfig.builder().withReadTimeout(Duration.ofMillis(-1)).build());
    }

    @Test
    void rejectsEmptyPayloadLimit() {
        assertThrows(IllegalArgumentException.class,
                () -> OobChannelConfig.builder().withMaxPayloadBytes(0).build());
    }

    @Test
    void rejectsMissingFields() {
        assertThrows(NullPointerException.class,
                () -> OobChannelConfig.builder().withWireFormat(null).build());
        assertThrows(NullPointerException.class,
                () -> OobChannelConfig.builder().withServiceRecord(null).build());
    }
}
