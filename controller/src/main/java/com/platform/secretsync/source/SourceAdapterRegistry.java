package com.platform.secretsync.source;

import com.platform.secretsync.crd.SourceRef;
import com.platform.secretsync.error.ValidationException;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Selects the source adapter for a {@link SourceRef} kind.
 */
@Component
public class SourceAdapterRegistry {

    private final Map<String, SourceAdapter> adapters;

    public SourceAdapterRegistry(List<SourceAdapter> adapters) {
        this.adapters = adapters.stream().collect(Collectors.toMap(SourceAdapter::kind, Function.identity()));
    }

    public SourceAdapter forRef(SourceRef sourceRef) {
        String kind = sourceRef.getKind() != null ? sourceRef.getKind() : SourceRef.FLUX_GIT_REPOSITORY;
        SourceAdapter adapter = adapters.get(kind);
        if (adapter == null) {
            throw new ValidationException("sourceRef.kind", kind, "supported kinds are " + adapters.keySet());
        }
        return adapter;
    }
}
