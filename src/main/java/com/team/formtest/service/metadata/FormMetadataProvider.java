package com.team.formtest.service.metadata;

import com.team.formtest.model.form.FormMetadata;

import java.util.List;
import java.util.Optional;

/**
 * Source of extracted form metadata.
 */
public interface FormMetadataProvider {

    Optional<FormMetadata> find(String id);

    /**
     * Store metadata, assigning an id when it has none.
     *
     * @throws IllegalArgumentException when the metadata is unusable
     */
    FormMetadata register(FormMetadata metadata);

    List<FormMetadata> list();
}
