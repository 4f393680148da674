package me.christianrobert.polyconv.context;

import me.christianrobert.polyconv.ast.ExpressionNode;

/**
 * The declared value type has no entry in the target's type-name table.
 */
public class TypeMappingGapException extends ConversionException {

    private final ValueType valueType;

    public TypeMappingGapException(String message, ValueType valueType, ExpressionNode node) {
        super(message, node);
        this.valueType = valueType;
    }

    public ValueType getValueType() {
        return valueType;
    }

    @Override
    public ErrorCategory getCategory() {
        return ErrorCategory.TYPE_MAPPING_GAP;
    }
}
