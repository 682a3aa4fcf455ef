package com.al.hl7generator.service.resolver;

import com.al.hl7generator.model.schema.CodeTable;
import com.al.hl7generator.schema.CodeTableProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Last link of the chain: a random row of the field's code table, otherwise a
 * primitive value of the field's type.
 */
@Component
public class FallbackValueResolver implements FieldValueResolver {

    static final int PRIORITY = 10;

    private final CodeTableProvider tableProvider;
    private final PrimitiveValueGenerator primitiveValueGenerator;

    @Autowired
    public FallbackValueResolver(CodeTableProvider tableProvider, PrimitiveValueGenerator primitiveValueGenerator) {
        this.tableProvider = tableProvider;
        this.primitiveValueGenerator = primitiveValueGenerator;
    }

    @Override
    public int getPriority() {
        return PRIORITY;
    }

    @Override
    public boolean canHandle(FieldResolutionContext context) {
        return true;
    }

    @Override
    public String resolve(FieldResolutionContext context) {
        if (context.getField().hasTable()) {
            Optional<CodeTable> table = tableProvider.getTable(context.getField().getTableId());
            if (table.isPresent() && !table.get().isEmpty()) {
                String code = context.getGenerationContext().pick(table.get().getValues()).getCode();
                return PrimitiveValueGenerator.truncate(code, context.getField().getLength());
            }
        }
        return primitiveValueGenerator.generate(context.getField(), context.getGenerationContext());
    }
}
