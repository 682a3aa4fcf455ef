package com.al.hl7generator.service.composer;

import com.al.hl7generator.model.schema.DataTypeComponent;
import org.springframework.stereotype.Component;

/**
 * Assigns an importance tier to a component of a composite data type from the
 * parent type, the component name and its position. Unknown parent types are
 * always {@link ComponentImportance#OPTIONAL}.
 */
@Component
public class ComponentImportanceClassifier {

    public ComponentImportance classify(String parentDataType, DataTypeComponent component) {
        if (parentDataType == null || component == null) {
            return ComponentImportance.OPTIONAL;
        }
        String name = component.getName() == null ? "" : component.getName().toLowerCase();
        int position = component.getPosition();

        switch (parentDataType.toUpperCase()) {
            case "XAD":
                return classifyAddress(name, position);
            case "XPN":
                return classifyPersonName(name, position);
            case "CX":
                return classifyIdentifier(name, position);
            case "XTN":
                return classifyTelecom(name, position);
            case "CE":
            case "CWE":
                return classifyCoded(name, position);
            default:
                return ComponentImportance.OPTIONAL;
        }
    }

    private ComponentImportance classifyAddress(String name, int position) {
        if (name.contains("street") || name.contains("city") || name.contains("state")
                || name.contains("zip") || name.contains("postal")
                || name.contains("address type") || position == 7) {
            return ComponentImportance.CRITICAL;
        }
        if (name.contains("other designation") || position == 2
                || name.contains("country") || position == 6) {
            return ComponentImportance.IMPORTANT;
        }
        return ComponentImportance.OPTIONAL;
    }

    private ComponentImportance classifyPersonName(String name, int position) {
        if (name.contains("family") || name.contains("given") || name.contains("first")) {
            return ComponentImportance.CRITICAL;
        }
        if (name.contains("middle") || name.contains("prefix") || name.contains("suffix")
                || (position >= 3 && position <= 5)) {
            return ComponentImportance.IMPORTANT;
        }
        return ComponentImportance.OPTIONAL;
    }

    private ComponentImportance classifyIdentifier(String name, int position) {
        if (position <= 3 || (name.contains("id") && !name.contains("assigning"))
                || name.contains("check digit")) {
            return ComponentImportance.CRITICAL;
        }
        if (position <= 5 || name.contains("assigning authority") || name.contains("identifier type")) {
            return ComponentImportance.IMPORTANT;
        }
        return ComponentImportance.OPTIONAL;
    }

    private ComponentImportance classifyTelecom(String name, int position) {
        if (position <= 3
                || (name.contains("telephone") && !name.contains("use") && !name.contains("equipment"))) {
            return ComponentImportance.CRITICAL;
        }
        if (name.contains("email") || position == 4 || name.contains("area") || position == 6) {
            return ComponentImportance.IMPORTANT;
        }
        return ComponentImportance.OPTIONAL;
    }

    private ComponentImportance classifyCoded(String name, int position) {
        if (position <= 2 || name.contains("identifier") || name.contains("text")) {
            return ComponentImportance.CRITICAL;
        }
        if (position == 3 || name.contains("coding system") || name.contains("alternate")) {
            return ComponentImportance.IMPORTANT;
        }
        return ComponentImportance.OPTIONAL;
    }
}
