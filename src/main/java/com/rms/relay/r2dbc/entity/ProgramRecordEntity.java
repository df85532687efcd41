package com.rms.relay.r2dbc.entity;

import java.time.LocalDateTime;

import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;



@Table("ETL_PRMREC")
public class ProgramRecordEntity {

    @Id
    @Column("PROGRAM_NAME")
    private String programName;

    @Column("LAST_SUCCESSFUL_TIME")
    private LocalDateTime lastSuccessfulTime;

    @Column("LAST_RUN_TIME")
    private LocalDateTime lastRunTime;

    @Column("STATUS")
    private String status;

    @Column("RECORDS_PROCESSED")
    private Long recordsProcessed;

    @Column("TOTAL_RECORDS_PROCESSED")
    private Long totalRecordsProcessed;

    @Column("ERROR_MESSAGE")
    private String errorMessage;

    @Column("CREATED_AT")
    private LocalDateTime createdAt;

    @Column("UPDATED_AT")
    private LocalDateTime updatedAt;

    public String getProgramName() { return programName; }
    public void setProgramName(String programName) { this.programName = programName; }

    public LocalDateTime getLastSuccessfulTime() { return lastSuccessfulTime; }
    public void setLastSuccessfulTime(LocalDateTime lastSuccessfulTime) { this.lastSuccessfulTime = lastSuccessfulTime; }

    public LocalDateTime getLastRunTime() { return lastRunTime; }
    public void setLastRunTime(LocalDateTime lastRunTime) { this.lastRunTime = lastRunTime; }

    public String getStatus() { return status; }
    public void setStatus(String status) { this.status = status; }

    public Long getRecordsProcessed() { return recordsProcessed; }
    public void setRecordsProcessed(Long recordsProcessed) { this.recordsProcessed = recordsProcessed; }

    public Long getTotalRecordsProcessed() { return totalRecordsProcessed; }
    public void setTotalRecordsProcessed(Long totalRecordsProcessed) { this.totalRecordsProcessed = totalRecordsProcessed; }

    public String getErrorMessage() { return errorMessage; }
    public void setErrorMessage(String errorMessage) { this.errorMessage = errorMessage; }

    public LocalDateTime getCreatedAt() { return createdAt; }
    public void setCreatedAt(LocalDateTime createdAt) { this.createdAt = createdAt; }

    public LocalDateTime getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(LocalDateTime updatedAt) { this.updatedAt = updatedAt; }
}
