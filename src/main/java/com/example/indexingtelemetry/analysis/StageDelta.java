package com.example.indexingtelemetry.analysis;

import lombok.Value;

import java.util.LinkedHashMap;
import java.util.Map;

@Value
public class StageDelta {
    long countA;
    long countB;

    public long getDifference() {
        return countA - countB;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("countA", countA);
        map.put("countB", countB);
        map.put("difference", getDifference());
        return map;
    }
}
