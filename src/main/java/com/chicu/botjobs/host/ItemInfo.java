package com.chicu.botjobs.host;

import java.util.Map;

public record ItemInfo(String itemId, String displayName, Map<String, String> attributes) {

    public ItemInfo {
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }
}
