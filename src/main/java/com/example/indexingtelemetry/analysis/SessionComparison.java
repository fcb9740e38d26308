package com.example.indexingtelemetry.analysis;

import lombok.Builder;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.SortedSet;

@Value
@Builder
public class SessionComparison {
    String sessionA;
    String sessionB;
    SortedSet<Long> onlyInA;
    SortedSet<Long> onlyInB;
    SortedSet<Long> inBoth;
    Map<String, StageDelta> stageDeltas;
    long errorsA;
    long errorsB;

    public Map<String, Object> toMap() {
        Map<String, Object> deltas = new LinkedHashMap<>();
        stageDeltas.forEach((stage, delta) -> deltas.put(stage, delta.toMap()));

        Map<String, Object> map = new LinkedHashMap<>();
        map.put("sessionA", sessionA);
        map.put("sessionB", sessionB);
        map.put("onlyInA", onlyInA);
        map.put("onlyInB", onlyInB);
        map.put("inBoth", inBoth);
        map.put("stageDeltas", deltas);
        map.put("errorsA", errorsA);
        map.put("errorsB", errorsB);
        return map;
    }
}
