package com.vantage.correlation;

import java.util.List;
import java.util.Objects;

public class CorrelationEdge {

    private final String sourceId;
    private final String targetId;
    private final String relationshipType;
    private final double score;
    private final List<String> evidence;

    public CorrelationEdge(String sourceId, String targetId, String relationshipType,
                           double score, List<String> evidence) {
        this.sourceId = sourceId;
        this.targetId = targetId;
        this.relationshipType = relationshipType;
        this.score = score;
        this.evidence = evidence == null ? List.of() : List.copyOf(evidence);
    }

    public String getSourceId() {
        return sourceId;
    }

    public String getTargetId() {
        return targetId;
    }

    public String getRelationshipType() {
        return relationshipType;
    }

    public double getScore() {
        return score;
    }

    public List<String> getEvidence() {
        return evidence;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CorrelationEdge)) {
            return false;
        }
        CorrelationEdge other = (CorrelationEdge) o;
        return Double.compare(score, other.score) == 0
                && sourceId.equals(other.sourceId)
                && targetId.equals(other.targetId)
                && Objects.equals(relationshipType, other.relationshipType)
                && evidence.equals(other.evidence);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sourceId, targetId, relationshipType, score, evidence);
    }

    @Override
    public String toString() {
        return sourceId + "->" + targetId + "(" + score + ")";
    }
}
