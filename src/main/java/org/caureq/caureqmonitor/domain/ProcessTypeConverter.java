package org.caureq.caureqmonitor.domain;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/** Stores {@link ProcessType} as its lowercase code ("cpu" / "memory"). */
@Converter(autoApply = true)
public class ProcessTypeConverter implements AttributeConverter<ProcessType, String> {
    @Override
    public String convertToDatabaseColumn(ProcessType type) {
        return type == null ? null : type.code();
    }

    @Override
    public ProcessType convertToEntityAttribute(String code) {
        return code == null ? null : ProcessType.fromCode(code);
    }
}
