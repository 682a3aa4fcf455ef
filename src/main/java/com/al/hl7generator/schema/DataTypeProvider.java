package com.al.hl7generator.schema;

import com.al.hl7generator.model.schema.DataTypeDefinition;

import java.util.Optional;

public interface DataTypeProvider {

    Optional<DataTypeDefinition> getDataType(String code);
}
