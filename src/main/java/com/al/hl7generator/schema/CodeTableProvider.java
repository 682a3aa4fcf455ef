package com.al.hl7generator.schema;

import com.al.hl7generator.model.schema.CodeTable;

import java.util.Optional;

public interface CodeTableProvider {

    Optional<CodeTable> getTable(int id);
}
