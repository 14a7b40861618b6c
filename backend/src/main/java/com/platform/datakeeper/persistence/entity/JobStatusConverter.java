package com.platform.datakeeper.persistence.entity;

import com.platform.datakeeper.job.JobStatus;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Stores {@link JobStatus} in its lower-case column form.
 */
@Converter
public class JobStatusConverter implements AttributeConverter<JobStatus, String> {
    
    @Override
    public String convertToDatabaseColumn(JobStatus status) {
        return status == null ? null : status.dbValue();
    }
    
    @Override
    public JobStatus convertToEntityAttribute(String value) {
        return value == null ? null : JobStatus.fromDbValue(value);
    }
}
