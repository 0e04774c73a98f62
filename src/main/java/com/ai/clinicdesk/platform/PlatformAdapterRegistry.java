package com.ai.clinicdesk.platform;

import com.ai.clinicdesk.exception.UnknownPlatformException;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Component
public class PlatformAdapterRegistry {

    private final Map<Platform, PlatformAdapter> adapters = new EnumMap<>(Platform.class);

    public PlatformAdapterRegistry(List<PlatformAdapter> adapters) {
        for (PlatformAdapter adapter : adapters) {
            this.adapters.put(adapter.platform(), adapter);
        }
    }

    /** @throws UnknownPlatformException for a path segment with no webhook adapter */
    public PlatformAdapter get(String pathSegment) {
        return Platform.fromPath(pathSegment)
                .map(adapters::get)
                .orElseThrow(() -> new UnknownPlatformException(pathSegment));
    }
}
