package com.al.hl7generator.schema;

import com.al.hl7generator.model.schema.SegmentSchema;

import java.util.Optional;

public interface SegmentProvider {

    Optional<SegmentSchema> getSegment(String code);
}
