package com.ouc.arq.sdk;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/** Captures everything an entity asks of its environment. */
public class RecordingSystemContext implements SystemContext {
    public final List<Packet> sent = new ArrayList<>();
    public final List<byte[]> delivered = new ArrayList<>();
    public final List<String> logs = new ArrayList<>();
    public final List<String> timerCalls = new ArrayList<>();
    public final Map<String, Double> metrics = new HashMap<>();
    public long time;

    @Override
    public void sendPacket(Packet packet) {
        sent.add(packet);
    }

    @Override
    public void startTimer(long delay, int timerId) {
        timerCalls.add("start " + timerId + " " + delay);
    }

    @Override
    public void cancelTimer(int timerId) {
        timerCalls.add("cancel " + timerId);
    }

    @Override
    public void deliverData(byte[] data) {
        delivered.add(data);
    }

    @Override
    public void log(String message) {
        logs.add(message);
    }

    @Override
    public long now() {
        return time;
    }

    @Override
    public void recordMetric(String name, double value) {
        metrics.put(name, value);
    }

    public Packet lastSent() {
        return sent.get(sent.size() - 1);
    }

    public void clear() {
        sent.clear();
        delivered.clear();
        logs.clear();
        timerCalls.clear();
    }
}
