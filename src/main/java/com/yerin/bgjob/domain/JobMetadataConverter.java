package com.yerin.bgjob.domain;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.yerin.bgjob.global.exception.AppException;
import com.yerin.bgjob.global.exception.code.CommonErrorCode;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter
public class JobMetadataConverter implements AttributeConverter<JobMetadata, String> {

    private static final ObjectMapper OM = new ObjectMapper();

    @Override
    public String convertToDatabaseColumn(JobMetadata attribute) {
        try {
            return OM.writeValueAsString(attribute == null ? JobMetadata.empty() : attribute);
        } catch (JsonProcessingException e) {
            throw new AppException(CommonErrorCode.SERIALIZATION_FAILED, e);
        }
    }

    @Override
    public JobMetadata convertToEntityAttribute(String dbData) {
        if (dbData == null || dbData.isBlank()) return JobMetadata.empty();
        try {
            return OM.readValue(dbData, JobMetadata.class);
        } catch (JsonProcessingException e) {
            throw new AppException(CommonErrorCode.SERIALIZATION_FAILED, e);
        }
    }
}
