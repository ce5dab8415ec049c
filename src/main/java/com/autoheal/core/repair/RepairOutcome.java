package com.autoheal.core.repair;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Immutable record of one repair attempt.
 *
 * Built with {@link #builder(String, FixStrategy)}; status and timestamp are required.
 * backupReference is set only when a file was backed up before mutation.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class RepairOutcome {

    @JsonProperty("issue_kind")
    private final String issueKind;

    @JsonProperty("fix_strategy")
    private final FixStrategy fixStrategy;

    @JsonProperty("action_description")
    private final String actionDescription;

    private final RepairStatus status;

    private final String file;

    @JsonProperty("backup_reference")
    private final String backupReference;

    @JsonProperty("error_detail")
    private final String errorDetail;

    private final String recommendation;

    /** Model or learned proposal; only on suggested outcomes. */
    private final String suggestion;

    private final Double confidence;

    private final LocalDateTime timestamp;

    private RepairOutcome(Builder b) {
        this.issueKind         = b.issueKind;
        this.fixStrategy       = b.fixStrategy;
        this.actionDescription = b.actionDescription;
        this.status            = Objects.requireNonNull(b.status, "status");
        this.file              = b.file;
        this.backupReference   = b.backupReference;
        this.errorDetail       = b.errorDetail;
        this.recommendation    = b.recommendation;
        this.suggestion        = b.suggestion;
        this.confidence        = b.confidence;
        this.timestamp         = Objects.requireNonNull(b.timestamp, "timestamp");
    }

    public String getIssueKind()         { return issueKind; }
    public FixStrategy getFixStrategy()  { return fixStrategy; }
    public String getActionDescription() { return actionDescription; }
    public RepairStatus getStatus()      { return status; }
    public String getFile()              { return file; }
    public String getBackupReference()   { return backupReference; }
    public String getErrorDetail()       { return errorDetail; }
    public String getRecommendation()    { return recommendation; }
    public String getSuggestion()        { return suggestion; }
    public Double getConfidence()        { return confidence; }
    public LocalDateTime getTimestamp()  { return timestamp; }

    /** success and failed outcomes carry a learning signal; skipped and suggested do not. */
    public boolean isConclusive() {
        return status == RepairStatus.SUCCESS || status == RepairStatus.FAILED;
    }

    @Override
    public String toString() {
        return String.format("RepairOutcome{%s/%s -> %s: %s}",
                issueKind, fixStrategy.id(), status.label(),
                actionDescription != null ? actionDescription : errorDetail);
    }

    // ----------------------------------------------------------------
    // Builder
    // ----------------------------------------------------------------

    public static Builder builder(String issueKind, FixStrategy fixStrategy) {
        return new Builder(issueKind, fixStrategy);
    }

    public static final class Builder {
        private final String      issueKind;
        private final FixStrategy fixStrategy;
        private String        actionDescription;
        private RepairStatus  status;
        private String        file;
        private String        backupReference;
        private String        errorDetail;
        private String        recommendation;
        private String        suggestion;
        private Double        confidence;
        private LocalDateTime timestamp;

        private Builder(String issueKind, FixStrategy fixStrategy) {
            this.issueKind   = issueKind;
            this.fixStrategy = fixStrategy;
        }

        public Builder action(String v)         { this.actionDescription = v; return this; }
        public Builder status(RepairStatus v)   { this.status = v;            return this; }
        public Builder file(String v)           { this.file = v;              return this; }
        public Builder backup(String v)         { this.backupReference = v;   return this; }
        public Builder error(String v)          { this.errorDetail = v;       return this; }
        public Builder recommendation(String v) { this.recommendation = v;    return this; }
        public Builder suggestion(String v)     { this.suggestion = v;        return this; }
        public Builder confidence(Double v)     { this.confidence = v;        return this; }
        public Builder at(LocalDateTime v)      { this.timestamp = v;         return this; }

        public RepairOutcome build() {
            return new RepairOutcome(this);
        }
    }
}
