package com.optics.osg.surface.hitmap;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;
import java.util.UUID;

/**
 * All hit points recorded on one surface during a run, grouped by bounce level
 * and then by bundle id, plus the damage-threshold violations found so far.
 */
public final class HitMap {
    private final NavigableMap<Integer, Map<UUID, RaysHitMap>> maps = new TreeMap<>();
    private final List<CriticalFluence> criticalFluences = new ArrayList<>();

    public void add(int bounce, UUID bundleId, HitPoint point) {
        maps.computeIfAbsent(bounce, b -> new LinkedHashMap<>())
                .computeIfAbsent(bundleId, id -> new RaysHitMap())
                .add(point);
    }

    /** The hit map of one bundle at one bounce level, null if nothing was recorded. */
    public RaysHitMap get(int bounce, UUID bundleId) {
        Map<UUID, RaysHitMap> level = maps.get(bounce);
        return level == null ? null : level.get(bundleId);
    }

    public Map<UUID, RaysHitMap> bounceLevel(int bounce) {
        return Collections.unmodifiableMap(maps.getOrDefault(bounce, Map.of()));
    }

    public List<Integer> bounceLevels() {
        return List.copyOf(maps.keySet());
    }

    /**
     * Records a damage-threshold violation. A later check of the same bundle at
     * the same bounce level replaces the earlier event.
     *
     * @return false if an event for that bundle and bounce level existed
     */
    public boolean addCriticalFluence(CriticalFluence event) {
        for (int i = 0; i < criticalFluences.size(); i++) {
            CriticalFluence known = criticalFluences.get(i);
            if (known.bounce() == event.bounce() && known.bundleId().equals(event.bundleId())) {
                criticalFluences.set(i, event);
                return false;
            }
        }
        criticalFluences.add(event);
        return true;
    }

    public List<CriticalFluence> criticalFluences() {
        return Collections.unmodifiableList(criticalFluences);
    }

    public int size() {
        int n = 0;
        for (var level : maps.values())
            for (var m : level.values())
                n += m.size();
        return n;
    }

    public boolean isEmpty() {
        return maps.isEmpty();
    }

    public void reset() {
        maps.clear();
        criticalFluences.clear();
    }
}
