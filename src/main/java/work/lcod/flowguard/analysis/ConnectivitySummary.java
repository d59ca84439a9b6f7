package work.lcod.flowguard.analysis;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Connectivity figures for one graph.
 */
public record ConnectivitySummary(
    int stepCount,
    int edgeCount,
    int depth,
    int maxFanout,
    List<String> orphans
) {
    public ConnectivitySummary {
        orphans = List.copyOf(orphans);
    }

    public Map<String, Object> toSerializableMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("steps", stepCount);
        map.put("edges", edgeCount);
        map.put("depth", depth);
        map.put("maxFanout", maxFanout);
        map.put("orphans", orphans);
        return map;
    }
}
