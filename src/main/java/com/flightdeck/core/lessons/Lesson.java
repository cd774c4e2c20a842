package com.flightdeck.core.lessons;

import com.fasterxml.jackson.annotation.JsonAlias;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A remembered error-to-fix association. Mutable: a recurrence of the same
 * error/fix pair bumps {@code successCount} and {@code lastUsedAt} in place.
 */
public class Lesson {

    private String id;
    private String errorPattern;
    private String errorContext;
    private String fix;
    private String fixDescription;
    private int successCount;
    private List<String> tags = new ArrayList<>();
    private Instant createdAt;
    @JsonAlias("lastUsed")
    private Instant lastUsedAt;

    public Lesson() {}

    public Lesson(String id, String errorPattern, String errorContext, String fix, String fixDescription,
                  int successCount, List<String> tags, Instant createdAt, Instant lastUsedAt) {
        this.id = id;
        this.errorPattern = errorPattern;
        this.errorContext = errorContext;
        this.fix = fix;
        this.fixDescription = fixDescription;
        this.successCount = successCount;
        this.tags = new ArrayList<>(tags);
        this.createdAt = createdAt;
        this.lastUsedAt = lastUsedAt;
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }
    public String getErrorPattern() { return errorPattern; }
    public void setErrorPattern(String errorPattern) { this.errorPattern = errorPattern; }
    public String getErrorContext() { return errorContext; }
    public void setErrorContext(String errorContext) { this.errorContext = errorContext; }
    public String getFix() { return fix; }
    public void setFix(String fix) { this.fix = fix; }
    public String getFixDescription() { return fixDescription; }
    public void setFixDescription(String fixDescription) { this.fixDescription = fixDescription; }
    public int getSuccessCount() { return successCount; }
    public void setSuccessCount(int successCount) { this.successCount = successCount; }
    public List<String> getTags() { return tags; }
    public void setTags(List<String> tags) { this.tags = tags != null ? new ArrayList<>(tags) : new ArrayList<>(); }
    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
    public Instant getLastUsedAt() { return lastUsedAt; }
    public void setLastUsedAt(Instant lastUsedAt) { this.lastUsedAt = lastUsedAt; }

    Lesson copy() {
        return new Lesson(id, errorPattern, errorContext, fix, fixDescription, successCount, tags, createdAt, lastUsedAt);
    }

    @Override
    public String toString() {
        return "Lesson[" + id + ", \"" + errorPattern + "\" -> " + fixDescription + " x" + successCount + "]";
    }
}
