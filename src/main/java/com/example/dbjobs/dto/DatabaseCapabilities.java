package com.example.dbjobs.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DatabaseCapabilities {
    private String version;
    private boolean supportsTransactions;
    private boolean supportsStoredProcedures;
    private boolean supportsViews;
    private boolean supportsMaterializedViews;
    private boolean supportsJson;
    private boolean supportsFullTextSearch;
    private int maxConnections;
    @Builder.Default
    private List<String> features = new ArrayList<>();
    @Builder.Default
    private List<String> extensions = new ArrayList<>();

    /**
     * 存入 ConnectionProfile.capabilities 的格式
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("version", version);
        map.put("supports_transactions", supportsTransactions);
        map.put("supports_stored_procedures", supportsStoredProcedures);
        map.put("supports_views", supportsViews);
        map.put("supports_materialized_views", supportsMaterializedViews);
        map.put("supports_json", supportsJson);
        map.put("supports_full_text_search", supportsFullTextSearch);
        map.put("max_connections", maxConnections);
        map.put("features", features);
        map.put("extensions", extensions);
        return map;
    }
}
