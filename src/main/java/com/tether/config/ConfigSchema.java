package com.tether.config;

import java.util.List;
import java.util.Map;

/**
 * Typed fields, defaults and constraints for Tether's configuration file.
 */
public class ConfigSchema {
    
    private final Map<String, FieldDefinition> fields;
    
    public ConfigSchema(Map<String, FieldDefinition> fields) {
        this.fields = Map.copyOf(fields);
    }
    
    /**
     * Validates a configuration map against the schema, filling in defaults.
     * 
     * @param config the configuration to validate, modified in place
     * @throws ConfigValidationException if validation fails
     */
    public void validate(Map<String, Object> config) throws ConfigValidationException {
        for (String key : config.keySet()) {
            if (!fields.containsKey(key)) {
                throw new ConfigValidationException(
                    String.format("Unknown configuration field '%s'", key));
            }
        }
        
        for (Map.Entry<String, FieldDefinition> entry : fields.entrySet()) {
            String fieldName = entry.getKey();
            FieldDefinition fieldDef = entry.getValue();
            
            Object value = config.get(fieldName);
            
            if (value == null) {
                if (fieldDef.defaultValue() != null) {
                    config.put(fieldName, fieldDef.defaultValue());
                } else if (fieldDef.required()) {
                    throw new ConfigValidationException(
                        String.format("Required field '%s' is missing", fieldName));
                }
                continue;
            }
            
            fieldDef.validate(fieldName, value);
        }
    }
    
    public Map<String, FieldDefinition> getFields() {
        return fields;
    }
    
    /**
     * Definition of a configuration field.
     */
    public static class FieldDefinition {
        private final FieldType type;
        private final boolean required;
        private final Object defaultValue;
        private final Number minValue;
        private final Number maxValue;
        private final String pattern;
        
        private FieldDefinition(Builder builder) {
            this.type = builder.type;
            this.required = builder.required;
            this.defaultValue = builder.defaultValue;
            this.minValue = builder.minValue;
            this.maxValue = builder.maxValue;
            this.pattern = builder.pattern;
        }
        
        /**
         * Validates a field value.
         */
        public void validate(String fieldName, Object value) throws ConfigValidationException {
            if (!type.isValid(value)) {
                throw new ConfigValidationException(
                    String.format("Field '%s' expected %s, got %s",
                        fieldName, type.name(), value.getClass().getSimpleName()));
            }
            
            if (value instanceof Number) {
                double numValue = ((Number) value).doubleValue();
                if (minValue != null && numValue < minValue.doubleValue()) {
                    throw new ConfigValidationException(
                        String.format("Field '%s' value %s is below minimum %s",
                            fieldName, value, minValue));
                }
                if (maxValue != null && numValue > maxValue.doubleValue()) {
                    throw new ConfigValidationException(
                        String.format("Field '%s' value %s is above maximum %s",
                            fieldName, value, maxValue));
                }
            }
            
            if (pattern != null) {
                if (value instanceof String) {
                    checkPattern(fieldName, (String) value);
                } else if (value instanceof List) {
                    for (Object element : (List<?>) value) {
                        checkPattern(fieldName, String.valueOf(element));
                    }
                }
            }
        }
        
        private void checkPattern(String fieldName, String value) throws ConfigValidationException {
            if (!value.matches(pattern)) {
                throw new ConfigValidationException(
                    String.format("Field '%s' value '%s' does not match pattern '%s'",
                        fieldName, value, pattern));
            }
        }
        
        public FieldType type() { return type; }
        public boolean required() { return required; }
        public Object defaultValue() { return defaultValue; }
        public Number minValue() { return minValue; }
        public Number maxValue() { return maxValue; }
        public String pattern() { return pattern; }
        
        /**
         * Builder for field definitions.
         */
        public static class Builder {
            private FieldType type;
            private boolean required = false;
            private Object defaultValue;
            private Number minValue;
            private Number maxValue;
            private String pattern;
            
            public Builder type(FieldType type) {
                this.type = type;
                return this;
            }
            
            public Builder required(boolean required) {
                this.required = required;
                return this;
            }
            
            public Builder defaultValue(Object defaultValue) {
                this.defaultValue = defaultValue;
                return this;
            }
            
            public Builder min(Number minValue) {
                this.minValue = minValue;
                return this;
            }
            
            public Builder max(Number maxValue) {
                this.maxValue = maxValue;
                return this;
            }
            
            public Builder pattern(String pattern) {
                this.pattern = pattern;
                return this;
            }
            
            public FieldDefinition build() {
                if (type == null) {
                    throw new IllegalStateException("Field type is required");
                }
                return new FieldDefinition(this);
            }
        }
    }
    
    /**
     * Supported field types.
     */
    public enum FieldType {
        STRING(String.class),
        NUMBER(Number.class),
        BOOLEAN(Boolean.class),
        STRING_LIST(List.class);
        
        private final Class<?> javaType;
        
        FieldType(Class<?> javaType) {
            this.javaType = javaType;
        }
        
        public boolean isValid(Object value) {
            if (value == null) return false;
            if (!javaType.isAssignableFrom(value.getClass())) return false;
            if (this == STRING_LIST) {
                for (Object element : (List<?>) value) {
                    if (!(element instanceof String)) return false;
                }
            }
            return true;
        }
    }
}
