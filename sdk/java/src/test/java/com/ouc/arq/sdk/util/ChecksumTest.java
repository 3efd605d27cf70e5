package com.ouc.arq.sdk.util;

import com.ouc.arq.sdk.Packet;
import com.ouc.arq.sdk.PacketHeader;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class ChecksumTest {

    @Test
    void sumsHeaderFieldsAndPayload() {
        byte[] payload = new byte[Packet.PAYLOAD_LENGTH];
        payload[0] = 10;
        payload[19] = 5;
        assertEquals(3 + (-1) + 15, Checksum.compute(3, -1, payload));
    }

    @Test
    void payloadBytesCountAsUnsigned() {
        byte[] payload = new byte[Packet.PAYLOAD_LENGTH];
        payload[0] = (byte) 0xFF;
        assertEquals(255, Checksum.compute(0, 0, payload));
    }

    @Test
    void freshPacketsAreIntact() {
        byte[] payload = "aaaaaaaaaaaaaaaaaaaa".getBytes(StandardCharsets.US_ASCII);
        assertFalse(Checksum.isCorrupted(Packet.createData(4, payload)));
        assertFalse(Checksum.isCorrupted(Packet.createAck(7)));
    }

    @Test
    void detectsOverwrittenPayload() {
        Packet original = Packet.createData(2, "bbbbbbbbbbbbbbbbbbbb".getBytes(StandardCharsets.US_ASCII));
        byte[] tampered = original.getPayload();
        Arrays.fill(tampered, 0, 4, (byte) 'z');
        assertTrue(Checksum.isCorrupted(new Packet(original.getHeader(), tampered)));
    }

    @Test
    void detectsOverwrittenHeader() {
        Packet ack = Packet.createAck(3);
        PacketHeader h = ack.getHeader();
        h.setAckNum(999999);
        assertTrue(Checksum.isCorrupted(new Packet(h, ack.getPayload())));
    }
}
