package com.example.retrievalservice.entity;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter(autoApply = true)
public class TokenStatusConverter implements AttributeConverter<TokenStatus, String> {

    @Override
    public String convertToDatabaseColumn(TokenStatus attribute) {
        return attribute == null ? null : attribute.dbValue();
    }

    @Override
    public TokenStatus convertToEntityAttribute(String dbData) {
        return dbData == null ? null : TokenStatus.valueOf(dbData.toUpperCase());
    }
}
