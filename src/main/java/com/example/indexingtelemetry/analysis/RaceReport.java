package com.example.indexingtelemetry.analysis;

import com.example.indexingtelemetry.race.RaceRecord;
import lombok.Builder;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Value
@Builder
public class RaceReport {
    int totalItemsAffected;
    List<RaceRecord> items;
    /** Correlation count per triggering stage, most frequent first. */
    Map<String, Long> stagePatterns;

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("totalItemsAffected", totalItemsAffected);
        map.put("items", items.stream().map(RaceRecord::toMap).collect(Collectors.toList()));
        map.put("stagePatterns", stagePatterns);
        return map;
    }
}
