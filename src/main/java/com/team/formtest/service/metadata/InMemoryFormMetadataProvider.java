package com.team.formtest.service.metadata;

import com.team.formtest.model.form.FieldSpec;
import com.team.formtest.model.form.FormMetadata;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

@Service
@Slf4j
public class InMemoryFormMetadataProvider implements FormMetadataProvider {

    private final Map<String, FormMetadata> forms = new ConcurrentHashMap<>();

    @Override
    public Optional<FormMetadata> find(String id) {
        return Optional.ofNullable(forms.get(id));
    }

    @Override
    public FormMetadata register(FormMetadata metadata) {
        validate(metadata);
        if (metadata.getId() == null || metadata.getId().isBlank()) {
            metadata.setId(UUID.randomUUID().toString().substring(0, 8));
        }
        forms.put(metadata.getId(), metadata);
        log.info("Registered form {} ({} fields) for {}", metadata.getId(), metadata.getFields().size(), metadata.getPageUrl());
        return metadata;
    }

    @Override
    public List<FormMetadata> list() {
        return List.copyOf(forms.values());
    }

    static void validate(FormMetadata metadata) {
        if (metadata == null) {
            throw new IllegalArgumentException("Form metadata is required");
        }
        if (metadata.getPageUrl() == null || metadata.getPageUrl().isBlank()) {
            throw new IllegalArgumentException("pageUrl is required");
        }
        if (metadata.getFields() == null || metadata.getFields().isEmpty()) {
            throw new IllegalArgumentException("At least one field is required");
        }
        Set<String> names = new HashSet<>();
        for (FieldSpec field : metadata.getFields()) {
            if (field.getName() == null || field.getName().isBlank()) {
                throw new IllegalArgumentException("Every field needs a name");
            }
            if (!names.add(field.getName())) {
                throw new IllegalArgumentException("Duplicate field name: " + field.getName());
            }
            if (field.getLocator() == null || field.getLocator().isBlank()) {
                throw new IllegalArgumentException("Field '" + field.getName() + "' has no locator");
            }
        }
    }
}
