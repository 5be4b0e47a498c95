package com.optics.osg.light;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/** Light data keyed by port name, in insertion order. */
public final class LightResult {
    private final Map<String, LightData> data = new LinkedHashMap<>();

    public static LightResult empty() {
        return new LightResult();
    }

    public static LightResult of(String port, LightData light) {
        return new LightResult().put(port, light);
    }

    public LightResult put(String port, LightData light) {
        data.put(port, light);
        return this;
    }

    public LightData get(String port) {
        return data.get(port);
    }

    public boolean contains(String port) {
        return data.containsKey(port);
    }

    public LightData remove(String port) {
        return data.remove(port);
    }

    public Set<String> ports() {
        return Collections.unmodifiableSet(data.keySet());
    }

    public Map<String, LightData> asMap() {
        return Collections.unmodifiableMap(data);
    }

    public boolean isEmpty() {
        return data.isEmpty();
    }

    public int size() {
        return data.size();
    }

    @Override
    public String toString() {
        return "LightResult" + data.keySet();
    }
}
